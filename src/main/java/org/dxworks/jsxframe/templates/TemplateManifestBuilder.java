package org.dxworks.jsxframe.templates;

import org.dxworks.jsxframe.model.ComponentDescriptor;
import org.dxworks.jsxframe.model.Template;
import org.dxworks.jsxframe.model.TemplateManifest;

import java.time.Clock;
import java.util.Map;

/**
 * Packs a component's templates into the {@code <Component>.templates.json} wire shape.
 * Text and attribute templates share the {@code templates} map; the other kinds are optional
 * top-level arrays, left out when empty.
 */
public class TemplateManifestBuilder {

    private final Clock clock;

    public TemplateManifestBuilder(Clock clock) {
        this.clock = clock;
    }

    public TemplateManifest build(ComponentDescriptor component) {
        TemplateManifest manifest = new TemplateManifest();
        manifest.component = component.name;
        manifest.generatedAt = clock.millis();
        for (Map.Entry<String, Template> entry : component.templates.entrySet()) {
            manifest.templates.put(entry.getKey(), wireTemplate(entry.getValue()));
        }
        if (!component.loopTemplates.isEmpty()) {
            manifest.loopTemplates = component.loopTemplates;
        }
        if (!component.structuralTemplates.isEmpty()) {
            manifest.structuralTemplates = component.structuralTemplates;
        }
        if (!component.expressionTemplates.isEmpty()) {
            manifest.expressionTemplates = component.expressionTemplates;
        }
        return manifest;
    }

    /**
     * Entries of the {@code templates} map carry text, bindings, slots, path and type, plus
     * conditional branches, a transform and the nullable flag when present.
     */
    static Template wireTemplate(Template source) {
        Template wire = new Template();
        wire.template = source.template;
        wire.bindings = source.bindings;
        wire.slots = source.slots;
        wire.path = source.path;
        wire.type = source.type;
        wire.conditionalTemplates = source.conditionalTemplates;
        wire.transform = source.transform;
        wire.nullable = Boolean.TRUE.equals(source.nullable) ? Boolean.TRUE : null;
        return wire;
    }
}
