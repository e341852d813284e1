package org.dxworks.jsxframe.ast;

public final class AssignmentExpression implements Expression {
    public final String operator;
    public final Pattern left;
    public final Expression right;

    public AssignmentExpression(String operator, Pattern left, Expression right) {
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    @Override
    public String getType() {
        return "AssignmentExpression";
    }
}
