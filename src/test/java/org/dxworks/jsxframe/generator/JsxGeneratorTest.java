package org.dxworks.jsxframe.generator;

import org.dxworks.jsxframe.analyzer.EventHandlerCollector;
import org.dxworks.jsxframe.analyzer.PluginAnalyzer;
import org.dxworks.jsxframe.ast.JsxElement;
import org.dxworks.jsxframe.compiler.CompilerContext;
import org.dxworks.jsxframe.compiler.StructuralValidationException;
import org.junit.jupiter.api.Test;

import static org.dxworks.jsxframe.Js.*;
import static org.dxworks.jsxframe.TestUtils.context;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsxGeneratorTest {

    private final CompilerContext context = context("Card");
    private final JsxGenerator generator = new JsxGenerator(context, new ExpressionGenerator(context));

    @Test
    void elementWithoutChildren() {
        assertEquals("new VElement(\"br\", new Dictionary<string, string>())", generator.generateNode(el("br"), 0));
    }

    @Test
    void classNameBecomesClassAndSingleTextChildIsInlined() {
        String code = generator.generateNode(el("div", attrs(attr("className", "box")), text("  hi  ")), 0);

        assertEquals("new VElement(\"div\", new Dictionary<string, string> { [\"class\"] = \"box\" }, \"hi\")", code);
    }

    @Test
    void styleObjectIsConvertedToCss() {
        String code = generator.generateNode(
                el("div", attrs(attr("style", object("marginTop", num(12), "color", str("red"))))), 0);

        assertTrue(code.contains("[\"style\"] = \"margin-top: 12px; color: red\""), code);
    }

    @Test
    void expressionAttributeIsInterpolated() {
        String code = generator.generateNode(el("img", attrs(attr("src", id("url")))), 0);

        assertEquals("new VElement(\"img\", new Dictionary<string, string> { [\"src\"] = $\"{url}\" })", code);
    }

    @Test
    void expressionChildrenGoIntoANodeArray() {
        String code = generator.generateNode(el("p", expr(id("name"))), 0);

        assertEquals("new VElement(\"p\", new Dictionary<string, string>(), new VNode[]\n"
                + "{\n"
                + "    new VText($\"{(name)}\")\n"
                + "})", code);
    }

    @Test
    void handlerAttributesUseCollectedNames() {
        JsxElement button = el("button", attrs(attr("onClick", arrow(call("save")))), text("Save"));
        context.component().renderBody = button;
        EventHandlerCollector.collect(context.component());

        String code = generator.generateNode(button, 0);

        assertTrue(code.contains("[\"onclick\"] = \"Handle0\""), code);
        assertTrue(code.endsWith(", \"Save\")"), code);
    }

    @Test
    void fragmentJoinsItsChildren() {
        String code = generator.generateNode(fragment(el("b"), text(" "), el("i")), 0);

        assertEquals("new Fragment(new VElement(\"b\", new Dictionary<string, string>()), "
                + "new VElement(\"i\", new Dictionary<string, string>()))", code);
    }

    @Test
    void mappedChildrenUseTheRuntimeHelper() {
        String code = generator.generateNode(
                el("ul", expr(method(id("items"), "map", arrow("item", el("li", expr(id("item"))))))), 0);

        assertTrue(code.startsWith("MinimactHelpers.createElement(\"ul\", "), code);
        assertTrue(code.contains("items.Select(item => "), code);
    }

    @Test
    void mapWithIndexSelectsWithBothParameters() {
        String code = generator.generateMapExpression(
                method(id("rows"), "map", arrow(java.util.List.of(id("row"), id("i")), el("tr"))), 0);

        assertEquals("rows.Select((row, i) => new VElement(\"tr\", new Dictionary<string, string>())).ToArray()", code);
    }

    @Test
    void pluginElementWithoutAnalysedUsageFails() {
        JsxElement analysed = el("Plugin", attrs(attr("name", "Clock"), attr("state", id("time"))));
        JsxElement unknown = el("Plugin", attrs(attr("name", "Weather"), attr("state", id("forecast"))));
        context.component().pluginUsages.addAll(new PluginAnalyzer(context).analyze(analysed));

        assertEquals("new PluginNode(\"Clock\", time)", generator.generateNode(analysed, 0));
        StructuralValidationException error = assertThrows(StructuralValidationException.class,
                () -> generator.generateNode(unknown, 0));
        assertEquals("Plugin metadata not found for <Plugin> element", error.getMessage());
    }
}
