package org.dxworks.jsxframe.ast;

public final class UnaryExpression implements Expression {
    public final String operator;
    public final Expression argument;

    public UnaryExpression(String operator, Expression argument) {
        this.operator = operator;
        this.argument = argument;
    }

    @Override
    public String getType() {
        return "UnaryExpression";
    }
}
