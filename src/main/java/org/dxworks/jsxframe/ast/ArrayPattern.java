package org.dxworks.jsxframe.ast;

import java.util.List;

public final class ArrayPattern implements Pattern {
    public final List<Pattern> elements;

    public ArrayPattern(List<Pattern> elements) {
        this.elements = NodeLists.copy(elements);
    }

    /**
     * Name bound at {@code index} when that element is a plain identifier, null otherwise.
     */
    public String nameAt(int index) {
        if (index < elements.size() && elements.get(index) instanceof Identifier id) {
            return id.name;
        }
        return null;
    }

    @Override
    public String getType() {
        return "ArrayPattern";
    }
}
