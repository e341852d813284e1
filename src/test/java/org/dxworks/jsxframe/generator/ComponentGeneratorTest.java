package org.dxworks.jsxframe.generator;

import org.dxworks.jsxframe.analyzer.ComponentAssembler;
import org.dxworks.jsxframe.ast.FunctionExpression;
import org.dxworks.jsxframe.compiler.CompilerContext;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.dxworks.jsxframe.Js.*;
import static org.dxworks.jsxframe.TestUtils.context;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ComponentGeneratorTest {

    private List<String> generate(String name, FunctionExpression function, Set<String> externalImports) {
        CompilerContext context = context(name);
        new ComponentAssembler(context).assemble(function, externalImports);
        return new ComponentGenerator(context).generate();
    }

    private static FunctionExpression counter() {
        return componentFunction(
                constDecl(arrayPattern("count", "setCount"), call("useState", num(0))),
                constDecl("doubled", bin("*", id("count"), num(2))),
                ret(el("button", attrs(attr("onClick", arrow(call("setCount", bin("+", id("count"), num(1)))))),
                        text("Count: "), expr(id("doubled")))));
    }

    @Test
    void counterClassLayout() {
        List<String> lines = generate("Counter", counter(), Set.of());

        assertEquals("[Component]", lines.get(0));
        assertEquals("public partial class Counter : MinimactComponent", lines.get(1));
        assertEquals("{", lines.get(2));
        assertEquals("    [State]", lines.get(3));
        assertEquals("    private int count = 0;", lines.get(4));
        assertEquals("}", lines.get(lines.size() - 1));

        int render = lines.indexOf("    protected override VNode Render()");
        int handler = lines.indexOf("    public void Handle0()");
        assertTrue(render > 4);
        assertTrue(handler > render);
        assertEquals("        StateManager.SyncMembersToState(this);", lines.get(render + 2));
        assertTrue(lines.contains("        var doubled = count * 2;"));
        assertEquals("        SetState(nameof(count), count + 1);", lines.get(handler + 2));
    }

    @Test
    void effectsListenToTheirDependencies() {
        List<String> lines = generate("Logger", componentFunction(
                constDecl(arrayPattern("query", "setQuery"), call("useState", str(""))),
                stmt(call("useEffect", arrowBlock(List.of(), stmt(method(id("console"), "log", id("query")))),
                        array(id("query")))),
                ret(el("p"))), Set.of());

        int effect = lines.indexOf("    private void Effect_0()");
        assertTrue(effect > 0);
        assertEquals("    [OnStateChanged(\"query\")]", lines.get(effect - 1));
    }

    @Test
    void loopTemplatesAreEmittedAsClassAttributes() {
        List<String> lines = generate("TodoList", componentFunction(
                constDecl(arrayPattern("todos", "setTodos"), call("useState", array())),
                ret(el("ul", expr(method(id("todos"), "map", arrow("todo",
                        el("li", expr(member("todo", "text"))))))))), Set.of());

        assertTrue(lines.get(0).startsWith("[LoopTemplate(\"todos\", @\"{"), lines.get(0));
        assertEquals("[Component]", lines.get(1));
    }

    @Test
    void declaredPropsBecomePropProperties() {
        CompilerContext context = context("Greeting");
        new ComponentAssembler(context).assemble(
                arrow(List.of(props("name")), el("h1", expr(id("name")))), Set.of());
        List<String> lines = new ComponentGenerator(context).generate();

        int prop = lines.indexOf("    [Prop]");
        assertTrue(prop > 0);
        assertTrue(lines.get(prop + 1).startsWith("    public ") && lines.get(prop + 1).endsWith(" name { get; set; }"));
    }

    @Test
    void valuesFromExternalLibrariesAreClientComputed() {
        List<String> lines = generate("Sorted", componentFunction(
                constDecl(arrayPattern("items", "setItems"), call("useState", array())),
                constDecl("sorted", method(id("_"), "sortBy", id("items"))),
                ret(el("div"))), Set.of("_"));

        assertTrue(lines.contains("    [ClientComputed(\"sorted\")]"));
        assertTrue(lines.stream().noneMatch(line -> line.startsWith("        var sorted")));
    }
}
