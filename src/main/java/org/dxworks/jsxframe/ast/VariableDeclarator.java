package org.dxworks.jsxframe.ast;

public final class VariableDeclarator implements Node {
    public final Pattern id;
    public final Expression init;

    public VariableDeclarator(Pattern id, Expression init) {
        this.id = id;
        this.init = init;
    }

    /**
     * The declared name for identifier bindings, null for destructuring.
     */
    public String name() {
        return id instanceof Identifier identifier ? identifier.name : null;
    }

    @Override
    public String getType() {
        return "VariableDeclarator";
    }
}
