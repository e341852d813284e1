package org.dxworks.jsxframe.model;

/**
 * Where the data an expression depends on lives.
 */
public enum Zone {
    STATIC,
    SERVER,
    CLIENT,
    HYBRID,
    MARKDOWN,
    MVC;

    public String wireName() {
        return name().toLowerCase();
    }
}
