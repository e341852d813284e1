package org.dxworks.jsxframe.ast;

import java.util.List;

public final class ImportDeclaration implements Statement {
    public final String source;
    public final List<ImportSpecifier> specifiers;

    public ImportDeclaration(String source, List<ImportSpecifier> specifiers) {
        this.source = source;
        this.specifiers = NodeLists.copy(specifiers);
    }

    @Override
    public String getType() {
        return "ImportDeclaration";
    }
}
