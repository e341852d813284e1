package org.dxworks.jsxframe.ast;

public final class AwaitExpression implements Expression {
    public final Expression argument;

    public AwaitExpression(Expression argument) {
        this.argument = argument;
    }

    @Override
    public String getType() {
        return "AwaitExpression";
    }
}
