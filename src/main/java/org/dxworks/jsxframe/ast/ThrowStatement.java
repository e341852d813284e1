package org.dxworks.jsxframe.ast;

public final class ThrowStatement implements Statement {
    public final Expression argument;

    public ThrowStatement(Expression argument) {
        this.argument = argument;
    }

    @Override
    public String getType() {
        return "ThrowStatement";
    }
}
