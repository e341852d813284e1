package org.dxworks.jsxframe.ast;

public final class StringLiteral implements Expression {
    public final String value;

    public StringLiteral(String value) {
        this.value = value;
    }

    @Override
    public String getType() {
        return "StringLiteral";
    }
}
