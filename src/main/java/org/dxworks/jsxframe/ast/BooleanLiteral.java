package org.dxworks.jsxframe.ast;

public final class BooleanLiteral implements Expression {
    public final boolean value;

    public BooleanLiteral(boolean value) {
        this.value = value;
    }

    @Override
    public String getType() {
        return "BooleanLiteral";
    }
}
