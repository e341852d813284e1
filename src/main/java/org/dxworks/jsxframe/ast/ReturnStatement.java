package org.dxworks.jsxframe.ast;

public final class ReturnStatement implements Statement {
    public final Expression argument;

    public ReturnStatement(Expression argument) {
        this.argument = argument;
    }

    @Override
    public String getType() {
        return "ReturnStatement";
    }
}
