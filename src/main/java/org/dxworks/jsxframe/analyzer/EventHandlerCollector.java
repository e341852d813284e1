package org.dxworks.jsxframe.analyzer;

import org.dxworks.jsxframe.ast.AstHelper;
import org.dxworks.jsxframe.ast.CallExpression;
import org.dxworks.jsxframe.ast.Expression;
import org.dxworks.jsxframe.ast.FunctionExpression;
import org.dxworks.jsxframe.ast.Identifier;
import org.dxworks.jsxframe.ast.JsxAttribute;
import org.dxworks.jsxframe.ast.MemberExpression;
import org.dxworks.jsxframe.ast.Node;
import org.dxworks.jsxframe.ast.Pattern;
import org.dxworks.jsxframe.ast.StringLiteral;
import org.dxworks.jsxframe.model.ComponentDescriptor;
import org.dxworks.jsxframe.model.EventHandlerInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * Names the handler behind every {@code on*} attribute of the render tree. Inline functions and
 * calls are lifted into {@code Handle<n>} methods, where n is the number of handlers known so far.
 */
public class EventHandlerCollector {

    static final String UNKNOWN_HANDLER = "UnknownHandler";

    private EventHandlerCollector() {
    }

    public static void collect(ComponentDescriptor component) {
        if (component.renderBody == null) {
            return;
        }
        AstHelper.walk(component.renderBody, node -> {
            if (node instanceof JsxAttribute attr && attr.name.startsWith("on")) {
                component.handlerNames.put(attr, handlerName(attr, component));
            }
        });
    }

    private static String handlerName(JsxAttribute attr, ComponentDescriptor component) {
        if (attr.value instanceof StringLiteral str) {
            return str.value;
        }
        Expression expr = attr.expression();
        if (expr instanceof FunctionExpression function) {
            String name = "Handle" + component.eventHandlers.size();
            component.eventHandlers.add(lift(name, function));
            return name;
        }
        if (expr instanceof Identifier id) {
            return id.name;
        }
        if (expr instanceof CallExpression call) {
            String name = "Handle" + component.eventHandlers.size();
            component.eventHandlers.add(new EventHandlerInfo(name, null, call));
            return name;
        }
        return UNKNOWN_HANDLER;
    }

    /**
     * {@code (e) => f(e.target.value)} is lifted as {@code (value) => f(value)}.
     */
    static EventHandlerInfo lift(String name, FunctionExpression function) {
        if (function.body instanceof CallExpression call
                && function.params.size() == 1
                && function.params.get(0) instanceof Identifier event) {
            List<Expression> arguments = new ArrayList<>();
            boolean rewritten = false;
            for (Expression argument : call.arguments) {
                if (isTargetValue(argument, event.name)) {
                    arguments.add(new Identifier("value"));
                    rewritten = true;
                } else {
                    arguments.add(argument);
                }
            }
            if (rewritten) {
                List<Pattern> params = List.of(new Identifier("value"));
                return new EventHandlerInfo(name, params, new CallExpression(call.callee, arguments));
            }
        }
        return new EventHandlerInfo(name, function.params, function.body);
    }

    private static boolean isTargetValue(Node node, String event) {
        return node instanceof MemberExpression member
                && "value".equals(member.propertyName())
                && AstHelper.isMember(member.object, event, "target");
    }
}
