package org.dxworks.jsxframe.generator;

import org.dxworks.jsxframe.ast.UnsupportedNode;
import org.dxworks.jsxframe.compiler.CompilerContext;
import org.dxworks.jsxframe.model.StateInfo;
import org.junit.jupiter.api.Test;

import static org.dxworks.jsxframe.Js.*;
import static org.dxworks.jsxframe.TestUtils.context;
import static org.junit.jupiter.api.Assertions.assertEquals;

class ExpressionGeneratorTest {

    private final ExpressionGenerator generator = new ExpressionGenerator(null);

    @Test
    void literals() {
        assertEquals("\"say \\\"hi\\\"\"", generator.generate(str("say \"hi\"")));
        assertEquals("42", generator.generate(num(42)));
        assertEquals("1.5", generator.generate(num(1.5)));
        assertEquals("true", generator.generate(bool(true)));
        assertEquals("null", generator.generate(nul()));
    }

    @Test
    void stringInsideInterpolationUsesEscapedQuotes() {
        assertEquals("\\\"a\\\"", generator.generate(str("a"), true));
    }

    @Test
    void lengthAndEventPropertiesArePascalCased() {
        assertEquals("items.Count", generator.generate(member("items", "length")));
        assertEquals("e.Target.Value", generator.generate(member("e", "target", "value")));
        assertEquals("user.name", generator.generate(member("user", "name")));
    }

    @Test
    void optionalChainingCapitalizesTheProperty() {
        assertEquals("user?.Name", generator.generate(optional(id("user"), "name")));
    }

    @Test
    void computedMemberUsesIndexer() {
        assertEquals("items[0]", generator.generate(index(id("items"), num(0))));
    }

    @Test
    void strictEqualityBecomesCSharpEquality() {
        assertEquals("a == b", generator.generate(bin("===", id("a"), id("b"))));
        assertEquals("a != 1", generator.generate(bin("!==", id("a"), num(1))));
    }

    @Test
    void conditionalIsParenthesized() {
        assertEquals("(done) ? \"yes\" : \"no\"", generator.generate(cond(id("done"), str("yes"), str("no"))));
    }

    @Test
    void templateLiteralBecomesInterpolatedString() {
        assertEquals("$\"Hello {name}!\"", generator.generate(template("Hello ", id("name"), "!")));
    }

    @Test
    void knownCallsAreMapped() {
        assertEquals("Math.Max(a, b)", generator.generate(call(member("Math", "max"), id("a"), id("b"))));
        assertEquals("Math.Min(a, 0)", generator.generate(call(member("Math", "min"), id("a"), num(0))));
        assertEquals("Console.WriteLine(\"x\" + y)",
                generator.generate(call(member("console", "log"), str("x"), id("y"))));
        assertEquals("price.ToString(\"F2\")", generator.generate(method(id("price"), "toFixed", num(2))));
        assertEquals("price.ToString(\"F2\")", generator.generate(method(id("price"), "toFixed")));
    }

    @Test
    void stateSetterCallBecomesSetState() {
        CompilerContext context = context("Counter");
        context.component().useState.add(new StateInfo("count", "setCount", "0", "int"));
        ExpressionGenerator withState = new ExpressionGenerator(context);

        assertEquals("SetState(nameof(count), count + 1)",
                withState.generate(call("setCount", bin("+", id("count"), num(1)))));
        assertEquals("save(count)", withState.generate(call("save", id("count"))));
    }

    @Test
    void arraysAndObjects() {
        assertEquals("new List<object> { 1, 2 }", generator.generate(array(num(1), num(2))));
        assertEquals("new { a = 1, b = \"x\" }", generator.generate(object("a", num(1), "b", str("x"))));
        assertEquals("new Dictionary<string, object> { [\"data-id\"] = 7 }",
                generator.generate(object("data-id", num(7))));
        assertEquals("null", generator.generate(object()));
    }

    @Test
    void unsupportedShapesComeOutAsNull() {
        assertEquals("null", generator.generate(new UnsupportedNode("ClassExpression")));
        assertEquals("null", generator.generate(null));
    }

    @Test
    void booleanOperandsFollowJavaScriptTruthiness() {
        assertEquals("new MObject(items)", generator.generateBoolean(id("items")));
        assertEquals("new MObject(user.active)", generator.generateBoolean(member("user", "active")));
        assertEquals("count > 0", generator.generateBoolean(bin(">", id("count"), num(0))));
    }
}
