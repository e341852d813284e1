package org.dxworks.jsxframe.ast;

public final class ThisExpression implements Expression {

    @Override
    public String getType() {
        return "ThisExpression";
    }
}
