package org.dxworks.jsxframe.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class TemplateManifest {
    public String component;
    public String version = "1.0";
    public long generatedAt;
    public Map<String, Template> templates = new LinkedHashMap<>();
    public List<LoopTemplate> loopTemplates;
    public List<StructuralTemplate> structuralTemplates;
    public List<ExpressionTemplate> expressionTemplates;
}
