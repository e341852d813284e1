package org.dxworks.jsxframe.model;

/**
 * A view-model property read with {@code useMvcState}; the setter is null for read-only use.
 */
public class MvcStateInfo {
    public String name;
    public String setter;
    public String propertyName;
    public String type;

    public MvcStateInfo(String name, String setter, String propertyName, String type) {
        this.name = name;
        this.setter = setter;
        this.propertyName = propertyName;
        this.type = type;
    }
}
