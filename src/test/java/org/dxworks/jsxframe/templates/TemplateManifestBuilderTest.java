package org.dxworks.jsxframe.templates;

import com.fasterxml.jackson.databind.JsonNode;
import org.dxworks.jsxframe.TestUtils;
import org.dxworks.jsxframe.model.ComponentDescriptor;
import org.dxworks.jsxframe.model.LoopTemplate;
import org.dxworks.jsxframe.model.Template;
import org.dxworks.jsxframe.model.TemplateManifest;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TemplateManifestBuilderTest {

    private final TemplateManifestBuilder builder = new TemplateManifestBuilder(TestUtils.FIXED_CLOCK);

    @Test
    void manifestCarriesComponentVersionAndClockTime() {
        ComponentDescriptor component = new ComponentDescriptor("Counter");
        Template template = new Template();
        template.template = "Count: {0}";
        component.templates.put("span[0].text[0]", template);

        TemplateManifest manifest = builder.build(component);

        assertEquals("Counter", manifest.component);
        assertEquals("1.0", manifest.version);
        assertEquals(1_700_000_000_000L, manifest.generatedAt);
        assertEquals("Count: {0}", manifest.templates.get("span[0].text[0]").template);
        assertNull(manifest.loopTemplates);
        assertNull(manifest.structuralTemplates);
        assertNull(manifest.expressionTemplates);
    }

    @Test
    void emptyKindsAreLeftOutOfTheJson() throws Exception {
        ComponentDescriptor component = new ComponentDescriptor("TodoList");
        LoopTemplate loop = new LoopTemplate();
        loop.stateKey = "todos";
        component.loopTemplates.add(loop);

        JsonNode json = TestUtils.APPROVAL_MAPPER.valueToTree(builder.build(component));

        assertTrue(json.has("loopTemplates"));
        assertEquals("todos", json.get("loopTemplates").get(0).get("stateKey").asText());
        assertFalse(json.has("structuralTemplates"));
        assertFalse(json.has("expressionTemplates"));
        assertTrue(json.get("templates").isEmpty());
    }

    @Test
    void templateEntriesCarryOnlyWireFields() {
        ComponentDescriptor component = new ComponentDescriptor("Link");
        Template template = new Template();
        template.template = "link-{0}";
        template.bindings.add("active");
        template.slots.add(5);
        template.path = List.of(0);
        template.type = "attribute";
        template.attribute = "className";
        template.conditionalBindingIndex = 0;
        template.nullable = false;
        component.templates.put("a[0].@className", template);

        JsonNode entry = TestUtils.APPROVAL_MAPPER.valueToTree(builder.build(component))
                .get("templates").get("a[0].@className");

        assertEquals(List.of("template", "bindings", "slots", "path", "type"), fieldNames(entry));
        assertEquals("link-{0}", entry.get("template").asText());
        assertEquals(5, entry.get("slots").get(0).asInt());
    }

    private static List<String> fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }
}
