package org.dxworks.jsxframe.compiler;

import org.dxworks.jsxframe.TestUtils;
import org.dxworks.jsxframe.ast.Program;
import org.dxworks.jsxframe.model.CompilationResult;
import org.dxworks.jsxframe.model.Diagnostic;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.dxworks.jsxframe.Js.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsxCompilerTest {

    private final JsxCompiler compiler = new JsxCompiler("MyApp.Components", TestUtils.FIXED_CLOCK);

    private static Program counterFile() {
        return program(
                importFrom("minimact", "useState"),
                export(component("Counter",
                        constDecl(arrayPattern("count", "setCount"), call("useState", num(0))),
                        ret(el("div",
                                el("span", text("Count: "), expr(id("count"))),
                                el("button", attrs(attr("onClick", arrow(call("setCount", bin("+", id("count"), num(1)))))),
                                        text("+")))))),
                component("Divider", ret(el("hr"))));
    }

    @Test
    void compilesEveryComponentIntoOneFile() {
        CompilationResult result = compiler.compile(counterFile());

        assertEquals(List.of("Counter", "Divider"), result.components);
        assertTrue(result.failedComponents.isEmpty());
        assertFalse(result.hasErrors());
        assertTrue(result.csharp.contains("namespace MyApp.Components;"));
        assertTrue(result.csharp.contains("public partial class Counter : MinimactComponent"));
        assertTrue(result.csharp.contains("public partial class Divider : MinimactComponent"));
        assertTrue(result.csharp.indexOf("class Counter") < result.csharp.indexOf("class Divider"));
        assertFalse(result.csharp.contains("Plugins"));
    }

    @Test
    void manifestsOnlyForComponentsWithTemplates() {
        CompilationResult result = compiler.compile(counterFile());

        assertEquals(List.of("Counter"), List.copyOf(result.manifests.keySet()));
        assertEquals(1_700_000_000_000L, result.manifests.get("Counter").generatedAt);
        assertEquals("Count: {0}", result.manifests.get("Counter").templates.get("[0].span[0].text[0]").template);
    }

    @Test
    void sameInputGivesSameOutput() throws Exception {
        CompilationResult first = compiler.compile(counterFile());
        CompilationResult second = compiler.compile(counterFile());

        assertEquals(first.csharp, second.csharp);
        assertEquals(TestUtils.APPROVAL_MAPPER.writeValueAsString(first.manifests),
                TestUtils.APPROVAL_MAPPER.writeValueAsString(second.manifests));
    }

    @Test
    void unexpectedFailureFailsOnlyItsComponent() {
        CompilationResult result = compiler.compile(program(
                component("Nameless", ret(el((String) null))),
                component("Divider", ret(el("hr")))));

        assertEquals(List.of("Divider"), result.components);
        assertEquals(List.of("Nameless"), result.failedComponents);
        Diagnostic error = result.diagnostics.stream()
                .filter(d -> d.severity == Diagnostic.Severity.ERROR)
                .findFirst().orElseThrow();
        assertEquals(Diagnostics.INTERNAL, error.code);
        assertEquals("Nameless", error.component);
        assertTrue(result.csharp.contains("public partial class Divider : MinimactComponent"));
    }

    @Test
    void duplicateComponentNameIsRejected() {
        CompilationResult result = compiler.compile(program(
                component("Card", ret(el("div", text("first")))),
                component("Card", ret(el("div", text("second"))))));

        assertEquals(List.of("Card"), result.components);
        assertEquals(List.of("Card"), result.failedComponents);
        assertTrue(result.hasErrors());
        assertTrue(result.csharp.contains("\"first\""));
        assertFalse(result.csharp.contains("\"second\""));
    }

    @Test
    void fileWithoutComponentsStillHasAHeader() {
        CompilationResult result = compiler.compile(program(constDecl("answer", num(42))));

        assertTrue(result.components.isEmpty());
        assertTrue(result.csharp.endsWith("namespace MyApp.Components;\n"));
    }

    @Test
    void invalidPluginFailsOnlyItsComponent() {
        CompilationResult result = compiler.compile(program(
                component("Broken", ret(el("div", el("Plugin", attrs(attr("state", id("time"))))))),
                component("Fine", ret(el("p")))));

        assertEquals(List.of("Fine"), result.components);
        assertEquals(List.of("Broken"), result.failedComponents);
        assertTrue(result.hasErrors());
        Diagnostic error = result.diagnostics.stream()
                .filter(d -> d.severity == Diagnostic.Severity.ERROR)
                .findFirst()
                .orElseThrow();
        assertEquals(Diagnostics.STRUCTURAL, error.code);
        assertEquals("Broken", error.component);
        assertEquals("Plugin element requires \"name\" attribute", error.message);
        assertFalse(result.csharp.contains("class Broken"));
    }

    @Test
    void pluginElementsRenderPluginNodes() {
        CompilationResult result = compiler.compile(program(component("Dashboard",
                constDecl(arrayPattern("time", "setTime"), call("useState", str("now"))),
                ret(el("div", el("Plugin", attrs(attr("name", "Clock"), attr("state", id("time")),
                        attr("version", "1.0"))))))));

        assertTrue(result.csharp.contains("using Minimact.AspNetCore.Plugins;"));
        assertTrue(result.csharp.contains("new PluginNode(\"Clock\", time)"));
        assertTrue(result.diagnostics.stream()
                .anyMatch(d -> d.code.equals(Diagnostics.PLUGIN) && d.message.contains("semver")));
        assertFalse(result.hasErrors());
    }
}
