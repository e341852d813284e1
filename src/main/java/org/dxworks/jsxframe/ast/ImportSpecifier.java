package org.dxworks.jsxframe.ast;

public final class ImportSpecifier implements Node {

    public enum Kind {
        DEFAULT,
        NAMED,
        NAMESPACE
    }

    public final Kind kind;
    public final String local;

    public ImportSpecifier(Kind kind, String local) {
        this.kind = kind;
        this.local = local;
    }

    @Override
    public String getType() {
        return switch (kind) {
            case DEFAULT -> "ImportDefaultSpecifier";
            case NAMED -> "ImportSpecifier";
            case NAMESPACE -> "ImportNamespaceSpecifier";
        };
    }
}
