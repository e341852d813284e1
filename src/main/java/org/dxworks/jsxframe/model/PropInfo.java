package org.dxworks.jsxframe.model;

public class PropInfo {
    public String name;
    public String type;

    public PropInfo(String name, String type) {
        this.name = name;
        this.type = type;
    }
}
