package org.dxworks.jsxframe.model;

public class MarkdownInfo {
    public String name;
    public String setter;
    public String initialValue;

    public MarkdownInfo(String name, String setter, String initialValue) {
        this.name = name;
        this.setter = setter;
        this.initialValue = initialValue;
    }
}
