package org.dxworks.jsxframe.ast;

import java.util.List;

public final class BlockStatement implements Statement {
    public final List<Statement> body;

    public BlockStatement(List<Statement> body) {
        this.body = NodeLists.copy(body);
    }

    @Override
    public String getType() {
        return "BlockStatement";
    }
}
