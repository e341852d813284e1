package org.dxworks.jsxframe.model;

public class ParameterInfo {
    public String name;
    public String type;

    public ParameterInfo(String name, String type) {
        this.name = name;
        this.type = type;
    }
}
