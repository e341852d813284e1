package org.dxworks.jsxframe.ast;

public final class SpreadElement implements Expression, ObjectMember {
    public final Expression argument;

    public SpreadElement(Expression argument) {
        this.argument = argument;
    }

    @Override
    public String getType() {
        return "SpreadElement";
    }
}
