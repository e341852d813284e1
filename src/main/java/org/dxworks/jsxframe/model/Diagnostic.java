package org.dxworks.jsxframe.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class Diagnostic {
    public enum Severity {
        WARNING,
        ERROR
    }

    public Severity severity;
    public String code;
    public String component;
    public String message;

    public Diagnostic(Severity severity, String code, String component, String message) {
        this.severity = severity;
        this.code = code;
        this.component = component;
        this.message = message;
    }

    @Override
    public String toString() {
        return severity + " " + code + (component != null ? " [" + component + "]" : "") + ": " + message;
    }
}
