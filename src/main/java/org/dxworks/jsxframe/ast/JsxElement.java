package org.dxworks.jsxframe.ast;

import java.util.List;

public final class JsxElement implements Expression, JsxChild {
    /** Tag name; member names such as {@code Plugin.Clock} are joined with dots. */
    public final String name;
    public final List<JsxAttributeItem> attributes;
    public final List<JsxChild> children;
    public final boolean selfClosing;

    public JsxElement(String name, List<JsxAttributeItem> attributes, List<JsxChild> children, boolean selfClosing) {
        this.name = name;
        this.attributes = NodeLists.copy(attributes);
        this.children = NodeLists.copy(children);
        this.selfClosing = selfClosing;
    }

    public JsxAttribute attribute(String attributeName) {
        for (JsxAttributeItem item : attributes) {
            if (item instanceof JsxAttribute attr && attr.name.equals(attributeName)) {
                return attr;
            }
        }
        return null;
    }

    @Override
    public String getType() {
        return "JSXElement";
    }
}
