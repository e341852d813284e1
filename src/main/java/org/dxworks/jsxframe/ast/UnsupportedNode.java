package org.dxworks.jsxframe.ast;

/**
 * Stands in for any input node outside the supported vocabulary. Generators
 * degrade to a neutral value when they meet one.
 */
public final class UnsupportedNode implements Expression, Statement, Pattern {
    public final String type;

    public UnsupportedNode(String type) {
        this.type = type;
    }

    @Override
    public String getType() {
        return type;
    }
}
