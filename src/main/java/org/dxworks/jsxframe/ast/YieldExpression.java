package org.dxworks.jsxframe.ast;

public final class YieldExpression implements Expression {
    public final Expression argument;
    public final boolean delegate;

    public YieldExpression(Expression argument, boolean delegate) {
        this.argument = argument;
        this.delegate = delegate;
    }

    @Override
    public String getType() {
        return "YieldExpression";
    }
}
