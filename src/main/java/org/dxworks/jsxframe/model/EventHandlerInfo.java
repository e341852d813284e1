package org.dxworks.jsxframe.model;

import org.dxworks.jsxframe.ast.Node;
import org.dxworks.jsxframe.ast.Pattern;

import java.util.ArrayList;
import java.util.List;

/**
 * A handler method. The body is a {@code BlockStatement} or an expression.
 */
public class EventHandlerInfo {
    public String name;
    public List<Pattern> params = new ArrayList<>();
    public Node body;

    public EventHandlerInfo(String name, List<Pattern> params, Node body) {
        this.name = name;
        if (params != null) {
            this.params.addAll(params);
        }
        this.body = body;
    }
}
