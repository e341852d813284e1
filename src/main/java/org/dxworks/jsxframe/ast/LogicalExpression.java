package org.dxworks.jsxframe.ast;

public final class LogicalExpression implements Expression {
    public final String operator;
    public final Expression left;
    public final Expression right;

    public LogicalExpression(String operator, Expression left, Expression right) {
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    public boolean isAnd() {
        return "&&".equals(operator);
    }

    @Override
    public String getType() {
        return "LogicalExpression";
    }
}
