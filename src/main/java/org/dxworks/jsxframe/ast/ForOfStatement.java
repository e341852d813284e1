package org.dxworks.jsxframe.ast;

public final class ForOfStatement implements Statement {
    /** A {@link VariableDeclaration} or a {@link Pattern}. */
    public final Node left;
    public final Expression right;
    public final Statement body;
    public final boolean await;

    public ForOfStatement(Node left, Expression right, Statement body, boolean await) {
        this.left = left;
        this.right = right;
        this.body = body;
        this.await = await;
    }

    @Override
    public String getType() {
        return "ForOfStatement";
    }
}
