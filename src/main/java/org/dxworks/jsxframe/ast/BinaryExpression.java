package org.dxworks.jsxframe.ast;

public final class BinaryExpression implements Expression {
    public final String operator;
    public final Expression left;
    public final Expression right;

    public BinaryExpression(String operator, Expression left, Expression right) {
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    @Override
    public String getType() {
        return "BinaryExpression";
    }
}
