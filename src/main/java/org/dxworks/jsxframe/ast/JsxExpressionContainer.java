package org.dxworks.jsxframe.ast;

public final class JsxExpressionContainer implements JsxChild {
    public final Expression expression;

    public JsxExpressionContainer(Expression expression) {
        this.expression = expression;
    }

    public boolean isEmpty() {
        return expression instanceof JsxEmptyExpression;
    }

    @Override
    public String getType() {
        return "JSXExpressionContainer";
    }
}
