package org.dxworks.jsxframe.ast;

import java.util.List;

public final class Program implements Node {
    public final List<Statement> body;

    public Program(List<Statement> body) {
        this.body = NodeLists.copy(body);
    }

    @Override
    public String getType() {
        return "Program";
    }
}
