package org.dxworks.jsxframe.model;

/**
 * A {@code useState} / {@code useClientState} variable. The initial value is already C# text.
 */
public class StateInfo {
    public String name;
    public String setter;
    public String initialValue;
    public String type;

    public StateInfo(String name, String setter, String initialValue, String type) {
        this.name = name;
        this.setter = setter;
        this.initialValue = initialValue;
        this.type = type;
    }
}
