package org.dxworks.jsxframe.ast;

public final class RegExpLiteral implements Expression {
    public final String pattern;
    public final String flags;

    public RegExpLiteral(String pattern, String flags) {
        this.pattern = pattern;
        this.flags = flags == null ? "" : flags;
    }

    @Override
    public String getType() {
        return "RegExpLiteral";
    }
}
