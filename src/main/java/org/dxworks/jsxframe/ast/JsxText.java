package org.dxworks.jsxframe.ast;

public final class JsxText implements JsxChild {
    public final String value;

    public JsxText(String value) {
        this.value = value;
    }

    @Override
    public String getType() {
        return "JSXText";
    }
}
