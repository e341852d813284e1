package org.dxworks.jsxframe.ast;

public final class TryStatement implements Statement {
    public final BlockStatement block;
    public final CatchClause handler;
    public final BlockStatement finalizer;

    public TryStatement(BlockStatement block, CatchClause handler, BlockStatement finalizer) {
        this.block = block;
        this.handler = handler;
        this.finalizer = finalizer;
    }

    @Override
    public String getType() {
        return "TryStatement";
    }
}
