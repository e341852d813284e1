package org.dxworks.jsxframe.ast;

public final class ExportDefaultDeclaration implements Statement {
    /** A {@link FunctionDeclaration} or an {@link Expression}. */
    public final Node declaration;

    public ExportDefaultDeclaration(Node declaration) {
        this.declaration = declaration;
    }

    @Override
    public String getType() {
        return "ExportDefaultDeclaration";
    }
}
