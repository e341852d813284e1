package org.dxworks.jsxframe.ast;

import java.util.List;

public final class FunctionDeclaration implements Statement {
    public final String id;
    public final List<Pattern> params;
    public final BlockStatement body;
    public final boolean async;
    public final boolean generator;
    public final TypeNode returnType;

    public FunctionDeclaration(String id, List<Pattern> params, BlockStatement body,
                               boolean async, boolean generator, TypeNode returnType) {
        this.id = id;
        this.params = NodeLists.copy(params);
        this.body = body;
        this.async = async;
        this.generator = generator;
        this.returnType = returnType;
    }

    @Override
    public String getType() {
        return "FunctionDeclaration";
    }
}
