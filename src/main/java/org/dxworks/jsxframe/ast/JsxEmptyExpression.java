package org.dxworks.jsxframe.ast;

/**
 * The expression of a container that only holds a comment.
 */
public final class JsxEmptyExpression implements Expression {

    @Override
    public String getType() {
        return "JSXEmptyExpression";
    }
}
