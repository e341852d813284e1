package org.dxworks.jsxframe.ast;

public final class ConditionalExpression implements Expression {
    public final Expression test;
    public final Expression consequent;
    public final Expression alternate;

    public ConditionalExpression(Expression test, Expression consequent, Expression alternate) {
        this.test = test;
        this.consequent = consequent;
        this.alternate = alternate;
    }

    @Override
    public String getType() {
        return "ConditionalExpression";
    }
}
