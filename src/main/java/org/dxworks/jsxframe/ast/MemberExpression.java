package org.dxworks.jsxframe.ast;

/**
 * Property access. {@code optional} is set for the {@code ?.} link of an optional chain.
 */
public final class MemberExpression implements Expression, Pattern {
    public final Expression object;
    public final Expression property;
    public final boolean computed;
    public final boolean optional;

    public MemberExpression(Expression object, Expression property, boolean computed, boolean optional) {
        this.object = object;
        this.property = property;
        this.computed = computed;
        this.optional = optional;
    }

    /**
     * Name of a non-computed property, null otherwise.
     */
    public String propertyName() {
        if (!computed && property instanceof Identifier id) {
            return id.name;
        }
        return null;
    }

    @Override
    public String getType() {
        return optional ? "OptionalMemberExpression" : "MemberExpression";
    }
}
