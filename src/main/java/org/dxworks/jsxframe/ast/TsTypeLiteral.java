package org.dxworks.jsxframe.ast;

import java.util.List;

public final class TsTypeLiteral implements TypeNode {
    public final List<TsPropertySignature> members;

    public TsTypeLiteral(List<TsPropertySignature> members) {
        this.members = NodeLists.copy(members);
    }

    public TsPropertySignature member(String name) {
        for (TsPropertySignature member : members) {
            if (member.name.equals(name)) {
                return member;
            }
        }
        return null;
    }

    @Override
    public String getType() {
        return "TSTypeLiteral";
    }
}
