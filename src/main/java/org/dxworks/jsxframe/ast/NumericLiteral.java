package org.dxworks.jsxframe.ast;

public final class NumericLiteral implements Expression {
    public final double value;

    public NumericLiteral(double value) {
        this.value = value;
    }

    @Override
    public String getType() {
        return "NumericLiteral";
    }
}
