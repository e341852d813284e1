package org.dxworks.jsxframe.ast;

import java.util.List;

public final class ObjectExpression implements Expression {
    public final List<ObjectMember> properties;

    public ObjectExpression(List<ObjectMember> properties) {
        this.properties = NodeLists.copy(properties);
    }

    @Override
    public String getType() {
        return "ObjectExpression";
    }
}
