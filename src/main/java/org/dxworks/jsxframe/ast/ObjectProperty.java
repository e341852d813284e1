package org.dxworks.jsxframe.ast;

/**
 * Property of an object literal or an object pattern. In a pattern the value is a {@link Pattern}.
 */
public final class ObjectProperty implements ObjectMember {
    public final Expression key;
    public final Node value;
    public final boolean computed;
    public final boolean shorthand;

    public ObjectProperty(Expression key, Node value, boolean computed, boolean shorthand) {
        this.key = key;
        this.value = value;
        this.computed = computed;
        this.shorthand = shorthand;
    }

    /**
     * Static key name for identifier, string and numeric keys; null for computed keys.
     */
    public String keyName() {
        if (computed) {
            return null;
        }
        if (key instanceof Identifier id) {
            return id.name;
        }
        if (key instanceof StringLiteral str) {
            return str.value;
        }
        if (key instanceof NumericLiteral num) {
            return AstHelper.formatNumber(num.value);
        }
        return null;
    }

    @Override
    public String getType() {
        return "ObjectProperty";
    }
}
