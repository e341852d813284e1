package org.dxworks.jsxframe.ast;

public final class WhileStatement implements Statement {
    public final Expression test;
    public final Statement body;

    public WhileStatement(Expression test, Statement body) {
        this.test = test;
        this.body = body;
    }

    @Override
    public String getType() {
        return "WhileStatement";
    }
}
