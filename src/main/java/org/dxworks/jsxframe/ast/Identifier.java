package org.dxworks.jsxframe.ast;

public final class Identifier implements Expression, Pattern {
    public final String name;
    public final TypeNode typeAnnotation;

    public Identifier(String name) {
        this(name, null);
    }

    public Identifier(String name, TypeNode typeAnnotation) {
        this.name = name;
        this.typeAnnotation = typeAnnotation;
    }

    @Override
    public String getType() {
        return "Identifier";
    }
}
