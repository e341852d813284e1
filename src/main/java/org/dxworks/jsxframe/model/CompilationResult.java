package org.dxworks.jsxframe.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of compiling one source file: the C# text, one manifest per component that has
 * templates, and every diagnostic raised along the way.
 */
public class CompilationResult {
    public String csharp;
    public List<String> components = new ArrayList<>();
    public List<String> failedComponents = new ArrayList<>();
    public Map<String, TemplateManifest> manifests = new LinkedHashMap<>();
    public List<Diagnostic> diagnostics = new ArrayList<>();

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.severity == Diagnostic.Severity.ERROR);
    }
}
