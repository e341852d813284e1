package org.dxworks.jsxframe.ast;

public final class ExportNamedDeclaration implements Statement {
    public final Statement declaration;

    public ExportNamedDeclaration(Statement declaration) {
        this.declaration = declaration;
    }

    @Override
    public String getType() {
        return "ExportNamedDeclaration";
    }
}
