package org.dxworks.jsxframe.ast;

public final class UpdateExpression implements Expression {
    public final String operator;
    public final Expression argument;
    public final boolean prefix;

    public UpdateExpression(String operator, Expression argument, boolean prefix) {
        this.operator = operator;
        this.argument = argument;
        this.prefix = prefix;
    }

    @Override
    public String getType() {
        return "UpdateExpression";
    }
}
