package org.dxworks.jsxframe.ast;

public final class RestElement implements Pattern, ObjectMember {
    public final Pattern argument;

    public RestElement(Pattern argument) {
        this.argument = argument;
    }

    @Override
    public String getType() {
        return "RestElement";
    }
}
