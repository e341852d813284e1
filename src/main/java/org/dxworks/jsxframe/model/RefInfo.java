package org.dxworks.jsxframe.model;

public class RefInfo {
    public String name;
    public String initialValue;

    public RefInfo(String name, String initialValue) {
        this.name = name;
        this.initialValue = initialValue;
    }
}
