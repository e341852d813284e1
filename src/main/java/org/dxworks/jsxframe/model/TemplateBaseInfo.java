package org.dxworks.jsxframe.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base layout chosen with {@code useTemplate}; its literal props become overridden properties.
 */
public class TemplateBaseInfo {
    public String name;
    public Map<String, String> props = new LinkedHashMap<>();

    public TemplateBaseInfo(String name) {
        this.name = name;
    }
}
