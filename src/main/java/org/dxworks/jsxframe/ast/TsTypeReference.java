package org.dxworks.jsxframe.ast;

import java.util.List;

public final class TsTypeReference implements TypeNode {
    public final String name;
    public final List<TypeNode> typeArguments;

    public TsTypeReference(String name, List<TypeNode> typeArguments) {
        this.name = name;
        this.typeArguments = NodeLists.copy(typeArguments);
    }

    @Override
    public String getType() {
        return "TSTypeReference";
    }
}
