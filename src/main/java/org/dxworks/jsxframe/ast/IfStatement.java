package org.dxworks.jsxframe.ast;

public final class IfStatement implements Statement {
    public final Expression test;
    public final Statement consequent;
    public final Statement alternate;

    public IfStatement(Expression test, Statement consequent, Statement alternate) {
        this.test = test;
        this.consequent = consequent;
        this.alternate = alternate;
    }

    @Override
    public String getType() {
        return "IfStatement";
    }
}
