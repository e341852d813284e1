package org.dxworks.jsxframe.templates;

import org.dxworks.jsxframe.model.Template;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.dxworks.jsxframe.Js.*;
import static org.junit.jupiter.api.Assertions.assertEquals;

class AttributeTemplateExtractorTest {

    @Test
    void templateLiteralAttributeIsKeyedByElementPath() {
        Map<String, Template> templates = AttributeTemplateExtractor.extract(
                el("div", el("p"), el("a", attrs(attr("className", template("link-", id("active"), ""))))));

        Template template = templates.get("a[0,0].@className");
        assertEquals("link-{0}", template.template);
        assertEquals(List.of("active"), template.bindings);
        assertEquals(List.of(5), template.slots);
        assertEquals(List.of(0, 0), template.path);
        assertEquals("className", template.attribute);
        assertEquals("attribute", template.type);
    }

    @Test
    void nonIdentifierPartsAreComplex() {
        Map<String, Template> templates = AttributeTemplateExtractor.extract(
                el("div", attrs(attr("style", template("width: ", member("size", "w"), "px; height: ", id("h"), "px")))));

        Template template = templates.get("div[0].@style");
        assertEquals("width: {0}px; height: {1}px", template.template);
        assertEquals(List.of(TextTemplateExtractor.COMPLEX, "h"), template.bindings);
        assertEquals(List.of(7, 22), template.slots);
    }

    @Test
    void plainAttributesAreIgnored() {
        Map<String, Template> templates = AttributeTemplateExtractor.extract(
                el("input", attrs(attr("type", "text"), attr("value", id("name")))));

        assertEquals(0, templates.size());
    }
}
