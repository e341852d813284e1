package org.dxworks.jsxframe.ast;

/**
 * A named attribute. The value is null (boolean attribute), a {@link StringLiteral},
 * a {@link JsxExpressionContainer} or a {@link JsxElement}.
 */
public final class JsxAttribute implements JsxAttributeItem {
    public final String name;
    public final Node value;

    public JsxAttribute(String name, Node value) {
        this.name = name;
        this.value = value;
    }

    /**
     * The contained expression when the value is an expression container, null otherwise.
     */
    public Expression expression() {
        if (value instanceof JsxExpressionContainer container && !container.isEmpty()) {
            return container.expression;
        }
        return null;
    }

    @Override
    public String getType() {
        return "JSXAttribute";
    }
}
