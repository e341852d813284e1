package org.dxworks.jsxframe.ast;

import java.util.List;

public final class ObjectPattern implements Pattern {
    public final List<ObjectMember> properties;
    public final TypeNode typeAnnotation;

    public ObjectPattern(List<ObjectMember> properties, TypeNode typeAnnotation) {
        this.properties = NodeLists.copy(properties);
        this.typeAnnotation = typeAnnotation;
    }

    @Override
    public String getType() {
        return "ObjectPattern";
    }
}
