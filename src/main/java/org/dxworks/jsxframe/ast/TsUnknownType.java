package org.dxworks.jsxframe.ast;

public final class TsUnknownType implements TypeNode {
    public final String type;

    public TsUnknownType(String type) {
        this.type = type;
    }

    @Override
    public String getType() {
        return type;
    }
}
