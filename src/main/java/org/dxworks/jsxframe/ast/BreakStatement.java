package org.dxworks.jsxframe.ast;

public final class BreakStatement implements Statement {

    @Override
    public String getType() {
        return "BreakStatement";
    }
}
