package org.dxworks.jsxframe.model;

public class ToggleInfo {
    public String name;
    public String toggleFunc;
    public String initialValue;

    public ToggleInfo(String name, String toggleFunc, String initialValue) {
        this.name = name;
        this.toggleFunc = toggleFunc;
        this.initialValue = initialValue;
    }
}
