package org.dxworks.jsxframe.templates;

import org.dxworks.jsxframe.model.Template;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.dxworks.jsxframe.Js.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TextTemplateExtractorTest {

    @Test
    void textWithBindingGetsPlaceholderSlotAndPath() {
        Map<String, Template> templates = TextTemplateExtractor.extract(
                el("div", el("span", text("Count: "), expr(id("count")))));

        assertEquals(1, templates.size());
        Template template = templates.get("[0].span[0].text[0]");
        assertEquals("Count: {0}", template.template);
        assertEquals(List.of("count"), template.bindings);
        assertEquals(List.of(7), template.slots);
        assertEquals(List.of(0, 0, 0), template.path);
        assertEquals("dynamic", template.type);
    }

    @Test
    void leadingWhitespaceIsTrimmedAndSlotsShifted() {
        Template template = TextTemplateExtractor.extract(
                el("p", text("\n    Total: "), expr(id("total")), text("\n"))).get("p[0].text[0]");

        assertEquals("Total: {0}", template.template);
        assertEquals(List.of(7), template.slots);
    }

    @Test
    void elementsSplitTextIntoSeparateRuns() {
        Map<String, Template> templates = TextTemplateExtractor.extract(
                el("p", text("Hello "), expr(id("name")), el("br"), text("Bye "), expr(id("name"))));

        assertEquals("Hello {0}", templates.get("p[0].text[0]").template);
        assertEquals(List.of(0, 0), templates.get("p[0].text[0]").path);
        assertEquals("Bye {0}", templates.get("p[0].text[1]").template);
        assertEquals(List.of(0, 1), templates.get("p[0].text[1]").path);
    }

    @Test
    void sameTagSiblingsAreNumberedByOrdinal() {
        Map<String, Template> templates = TextTemplateExtractor.extract(
                el("ul", el("li", expr(id("first"))), el("li", expr(id("second")))));

        assertEquals(List.of("first"), templates.get("[0].li[0].text[0]").bindings);
        assertEquals(List.of("second"), templates.get("[0].li[1].text[0]").bindings);
        assertEquals(List.of(0, 1, 0), templates.get("[0].li[1].text[0]").path);
    }

    @Test
    void fragmentRootIsTransparent() {
        Map<String, Template> templates = TextTemplateExtractor.extract(
                fragment(el("p", expr(id("x"))), el("p", expr(id("y")))));

        assertEquals(List.of("x"), templates.get("p[0].text[0]").bindings);
        assertEquals(List.of("y"), templates.get("p[1].text[0]").bindings);
    }

    @Test
    void staticTextHasNoBindings() {
        Template template = TextTemplateExtractor.extract(el("h1", text("  Title  "))).get("h1[0].text[0]");

        assertEquals("Title", template.template);
        assertEquals("static", template.type);
        assertTrue(template.bindings.isEmpty());
    }

    @Test
    void whitelistedMethodCallBecomesTransform() {
        Template template = TextTemplateExtractor.extract(
                el("span", text("$"), expr(method(id("price"), "toFixed", num(2))))).get("span[0].text[0]");

        assertEquals("${0}", template.template);
        assertEquals(List.of("price"), template.bindings);
        assertEquals("transform", template.type);
        assertEquals("toFixed", template.transform.method);
        assertEquals(List.of(2L), template.transform.args);
    }

    @Test
    void optionalChainIsNullable() {
        Template template = TextTemplateExtractor.extract(
                el("span", expr(optional(id("user"), "name")))).get("span[0].text[0]");

        assertEquals(List.of("user.name"), template.bindings);
        assertEquals("nullable", template.type);
        assertEquals(Boolean.TRUE, template.nullable);
    }

    @Test
    void literalTernaryBecomesConditionalTemplate() {
        Template template = TextTemplateExtractor.extract(
                el("span", expr(cond(id("done"), str("Yes"), str("No"))))).get("span[0].text[0]");

        assertEquals("conditional", template.type);
        assertEquals(List.of("done"), template.bindings);
        assertEquals("Yes", template.conditionalTemplates.get("true"));
        assertEquals("No", template.conditionalTemplates.get("false"));
    }

    @Test
    void operatorsWithOneVariableBindThatVariable() {
        Map<String, Template> templates = TextTemplateExtractor.extract(
                el("div", el("b", expr(bin("+", id("count"), num(1)))), el("i", expr(bin("+", id("a"), id("b"))))));

        assertEquals(List.of("count"), templates.get("[0].b[0].text[0]").bindings);
        assertEquals(List.of(TextTemplateExtractor.COMPLEX), templates.get("[0].i[0].text[0]").bindings);
    }

    @Test
    void structuralChildrenAreLeftToOtherExtractors() {
        Map<String, Template> templates = TextTemplateExtractor.extract(
                el("div",
                        expr(and(id("show"), el("span", text("shown")))),
                        expr(method(id("items"), "map", arrow("item", el("li"))))));

        assertNull(templates.get("div[0].text[0]"));
        assertTrue(templates.isEmpty());
    }

    @Test
    void nonJsxRenderBodyHasNoTextTemplates() {
        assertTrue(TextTemplateExtractor.extract(cond(id("x"), str("a"), str("b"))).isEmpty());
    }
}
