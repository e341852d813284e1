package org.dxworks.jsxframe.ast;

public final class CatchClause implements Node {
    public final Pattern param;
    public final BlockStatement body;

    public CatchClause(Pattern param, BlockStatement body) {
        this.param = param;
        this.body = body;
    }

    @Override
    public String getType() {
        return "CatchClause";
    }
}
