package org.dxworks.jsxframe.compiler;

/**
 * A special element lacks something it cannot be compiled without. Aborts the current
 * component only.
 */
public class StructuralValidationException extends RuntimeException {

    public StructuralValidationException(String message) {
        super(message);
    }
}
