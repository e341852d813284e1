package org.dxworks.jsxframe.ast;

/**
 * Keyword types such as {@code string}, {@code number}, {@code boolean} or {@code any}.
 */
public final class TsKeywordType implements TypeNode {
    public final String keyword;

    public TsKeywordType(String keyword) {
        this.keyword = keyword;
    }

    @Override
    public String getType() {
        return "TS" + Character.toUpperCase(keyword.charAt(0)) + keyword.substring(1) + "Keyword";
    }
}
