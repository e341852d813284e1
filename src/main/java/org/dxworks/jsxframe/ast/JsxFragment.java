package org.dxworks.jsxframe.ast;

import java.util.List;

public final class JsxFragment implements Expression, JsxChild {
    public final List<JsxChild> children;

    public JsxFragment(List<JsxChild> children) {
        this.children = NodeLists.copy(children);
    }

    @Override
    public String getType() {
        return "JSXFragment";
    }
}
