package org.dxworks.jsxframe.ast;

public final class TsPropertySignature implements Node {
    public final String name;
    public final TypeNode typeAnnotation;
    public final boolean optional;

    public TsPropertySignature(String name, TypeNode typeAnnotation, boolean optional) {
        this.name = name;
        this.typeAnnotation = typeAnnotation;
        this.optional = optional;
    }

    @Override
    public String getType() {
        return "TSPropertySignature";
    }
}
