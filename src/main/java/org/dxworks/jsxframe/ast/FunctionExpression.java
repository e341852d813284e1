package org.dxworks.jsxframe.ast;

import java.util.List;

/**
 * Arrow functions and function expressions. The body is a {@link BlockStatement}
 * or, for concise arrows, an {@link Expression}.
 */
public final class FunctionExpression implements Expression {
    public final String id;
    public final List<Pattern> params;
    public final Node body;
    public final boolean arrow;
    public final boolean async;
    public final boolean generator;
    public final TypeNode returnType;

    public FunctionExpression(String id, List<Pattern> params, Node body, boolean arrow,
                              boolean async, boolean generator, TypeNode returnType) {
        this.id = id;
        this.params = NodeLists.copy(params);
        this.body = body;
        this.arrow = arrow;
        this.async = async;
        this.generator = generator;
        this.returnType = returnType;
    }

    public boolean hasBlockBody() {
        return body instanceof BlockStatement;
    }

    @Override
    public String getType() {
        return arrow ? "ArrowFunctionExpression" : "FunctionExpression";
    }
}
