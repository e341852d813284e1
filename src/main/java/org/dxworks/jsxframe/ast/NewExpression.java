package org.dxworks.jsxframe.ast;

import java.util.List;

public final class NewExpression implements Expression {
    public final Expression callee;
    public final List<Expression> arguments;

    public NewExpression(Expression callee, List<Expression> arguments) {
        this.callee = callee;
        this.arguments = NodeLists.copy(arguments);
    }

    @Override
    public String getType() {
        return "NewExpression";
    }
}
