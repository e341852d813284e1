package org.dxworks.jsxframe.compiler;

import org.dxworks.jsxframe.model.Diagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class Diagnostics {
    private static final Logger log = LoggerFactory.getLogger(Diagnostics.class);

    public static final String MALFORMED_HOOK = "MALFORMED_HOOK";
    public static final String TEMPLATE_EXTRACTION = "TEMPLATE_EXTRACTION";
    public static final String UNSUPPORTED_TRANSFORM = "UNSUPPORTED_TRANSFORM";
    public static final String PLUGIN = "PLUGIN";
    public static final String STRUCTURAL = "STRUCTURAL";
    public static final String INTERNAL = "INTERNAL";

    private final List<Diagnostic> entries = new ArrayList<>();

    public void warn(String code, String component, String message) {
        log.warn("[{}] {}", component, message);
        entries.add(new Diagnostic(Diagnostic.Severity.WARNING, code, component, message));
    }

    public void error(String code, String component, String message) {
        log.error("[{}] {}", component, message);
        entries.add(new Diagnostic(Diagnostic.Severity.ERROR, code, component, message));
    }

    public List<Diagnostic> entries() {
        return Collections.unmodifiableList(entries);
    }
}
