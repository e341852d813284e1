package org.dxworks.jsxframe.ast;

public final class AssignmentPattern implements Pattern {
    public final Pattern left;
    public final Expression right;

    public AssignmentPattern(Pattern left, Expression right) {
        this.left = left;
        this.right = right;
    }

    @Override
    public String getType() {
        return "AssignmentPattern";
    }
}
