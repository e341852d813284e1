package org.dxworks.jsxframe.ast;

public final class TsArrayType implements TypeNode {
    public final TypeNode elementType;

    public TsArrayType(TypeNode elementType) {
        this.elementType = elementType;
    }

    @Override
    public String getType() {
        return "TSArrayType";
    }
}
