package org.dxworks.jsxframe.ast;

public final class ContinueStatement implements Statement {

    @Override
    public String getType() {
        return "ContinueStatement";
    }
}
