package org.dxworks.jsxframe.ast;

public final class JsxSpreadAttribute implements JsxAttributeItem {
    public final Expression argument;

    public JsxSpreadAttribute(Expression argument) {
        this.argument = argument;
    }

    @Override
    public String getType() {
        return "JSXSpreadAttribute";
    }
}
