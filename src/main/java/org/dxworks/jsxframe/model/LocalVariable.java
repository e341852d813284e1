package org.dxworks.jsxframe.model;

import org.dxworks.jsxframe.ast.Expression;

public class LocalVariable {
    public String name;
    public String type;
    public String initialValue;
    public boolean clientComputed;
    public boolean function;
    public Expression init;

    public LocalVariable(String name, String type, String initialValue, boolean clientComputed,
                         boolean function, Expression init) {
        this.name = name;
        this.type = type;
        this.initialValue = initialValue;
        this.clientComputed = clientComputed;
        this.function = function;
        this.init = init;
    }
}
