package org.dxworks.jsxframe.ast;

public final class ForStatement implements Statement {
    /** A {@link VariableDeclaration}, an {@link Expression} or null. */
    public final Node init;
    public final Expression test;
    public final Expression update;
    public final Statement body;

    public ForStatement(Node init, Expression test, Expression update, Statement body) {
        this.init = init;
        this.test = test;
        this.update = update;
        this.body = body;
    }

    @Override
    public String getType() {
        return "ForStatement";
    }
}
