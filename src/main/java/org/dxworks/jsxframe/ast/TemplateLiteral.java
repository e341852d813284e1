package org.dxworks.jsxframe.ast;

import java.util.List;

/**
 * A template literal; {@code quasis} holds one more entry than {@code expressions}.
 */
public final class TemplateLiteral implements Expression {
    public final List<String> quasis;
    public final List<String> cooked;
    public final List<Expression> expressions;

    public TemplateLiteral(List<String> quasis, List<String> cooked, List<Expression> expressions) {
        this.quasis = NodeLists.copy(quasis);
        this.cooked = NodeLists.copy(cooked == null ? quasis : cooked);
        this.expressions = NodeLists.copy(expressions);
    }

    @Override
    public String getType() {
        return "TemplateLiteral";
    }
}
