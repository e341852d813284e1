package org.dxworks.jsxframe.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

final class NodeLists {

    private NodeLists() {
    }

    // keeps null entries for array holes
    static <T> List<T> copy(List<? extends T> items) {
        if (items == null || items.isEmpty()) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(new ArrayList<>(items));
    }
}
