package org.dxworks.jsxframe.ast;

/**
 * The input JSON is not a Babel {@code File} or {@code Program} tree, or could not be read.
 */
public class AstReadException extends RuntimeException {

    public AstReadException(String message) {
        super(message);
    }

    public AstReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
