package org.dxworks.jsxframe.templates;

import org.dxworks.jsxframe.ast.Expression;
import org.dxworks.jsxframe.ast.JsxChild;
import org.dxworks.jsxframe.ast.JsxElement;
import org.dxworks.jsxframe.ast.JsxFragment;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Visits the elements of a render tree with their ordinal path. An element's index is its
 * position among same-tag siblings; fragments are transparent.
 */
abstract class ElementPathWalker {

    void walk(Expression renderBody) {
        if (renderBody instanceof JsxElement || renderBody instanceof JsxFragment) {
            visitChildren(List.of((JsxChild) renderBody), List.of(), new HashMap<>());
        }
    }

    /**
     * @param path        the element's own path, ending with its index
     * @param parentPath  the path of the enclosing element
     */
    protected abstract void visitElement(JsxElement element, int index, List<Integer> parentPath, List<Integer> path);

    protected void visitChildrenOf(JsxElement element, List<Integer> path) {
        visitChildren(element.children, path, new HashMap<>());
    }

    private void visitChildren(List<JsxChild> children, List<Integer> parentPath, Map<String, Integer> tagCounts) {
        for (JsxChild child : children) {
            if (child instanceof JsxElement element) {
                int index = tagCounts.merge(element.name, 1, Integer::sum) - 1;
                visitElement(element, index, parentPath, append(parentPath, index));
            } else if (child instanceof JsxFragment fragment) {
                visitChildren(fragment.children, parentPath, tagCounts);
            }
        }
    }

    static List<Integer> append(List<Integer> path, int index) {
        List<Integer> result = new ArrayList<>(path);
        result.add(index);
        return result;
    }

    /**
     * {@code [0].[1].span[0]} style key: parent indices in brackets, then the tag and its index.
     */
    static String pathKey(String tag, int index, List<Integer> parentPath) {
        StringBuilder key = new StringBuilder();
        for (Integer segment : parentPath) {
            key.append('[').append(segment).append("].");
        }
        return key.append(tag).append('[').append(index).append(']').toString();
    }
}
