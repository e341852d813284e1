package org.dxworks.jsxframe.ast;

import java.util.List;

public final class ArrayExpression implements Expression {
    public final List<Expression> elements;

    public ArrayExpression(List<Expression> elements) {
        this.elements = NodeLists.copy(elements);
    }

    @Override
    public String getType() {
        return "ArrayExpression";
    }
}
