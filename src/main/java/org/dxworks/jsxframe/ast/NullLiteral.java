package org.dxworks.jsxframe.ast;

public final class NullLiteral implements Expression {

    @Override
    public String getType() {
        return "NullLiteral";
    }
}
