package org.dxworks.jsxframe.ast;

import java.util.List;

/**
 * A call. {@code typeArguments} holds explicit generic arguments such as {@code useState<decimal>(0)}.
 */
public final class CallExpression implements Expression {
    public final Expression callee;
    public final List<Expression> arguments;
    public final boolean optional;
    public final List<TypeNode> typeArguments;

    public CallExpression(Expression callee, List<Expression> arguments) {
        this(callee, arguments, false, List.of());
    }

    public CallExpression(Expression callee, List<Expression> arguments, boolean optional) {
        this(callee, arguments, optional, List.of());
    }

    public CallExpression(Expression callee, List<Expression> arguments, boolean optional, List<TypeNode> typeArguments) {
        this.callee = callee;
        this.arguments = NodeLists.copy(arguments);
        this.optional = optional;
        this.typeArguments = NodeLists.copy(typeArguments);
    }

    public Expression argument(int index) {
        return index < arguments.size() ? arguments.get(index) : null;
    }

    @Override
    public String getType() {
        return "CallExpression";
    }
}
