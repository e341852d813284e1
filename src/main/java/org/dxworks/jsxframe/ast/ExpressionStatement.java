package org.dxworks.jsxframe.ast;

public final class ExpressionStatement implements Statement {
    public final Expression expression;

    public ExpressionStatement(Expression expression) {
        this.expression = expression;
    }

    @Override
    public String getType() {
        return "ExpressionStatement";
    }
}
