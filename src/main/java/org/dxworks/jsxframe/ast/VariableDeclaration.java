package org.dxworks.jsxframe.ast;

import java.util.List;

public final class VariableDeclaration implements Statement {
    public final String kind;
    public final List<VariableDeclarator> declarations;

    public VariableDeclaration(String kind, List<VariableDeclarator> declarations) {
        this.kind = kind;
        this.declarations = NodeLists.copy(declarations);
    }

    @Override
    public String getType() {
        return "VariableDeclaration";
    }
}
