package org.dxworks.jsxframe.model;

import org.dxworks.jsxframe.ast.Expression;
import org.dxworks.jsxframe.ast.JsxElement;

/**
 * A {@code <Plugin name="..." state={...} />} element found in the render tree.
 */
public class PluginUsage {
    public String pluginName;
    public StateBinding stateBinding;
    public String version;
    public JsxElement element;

    public PluginUsage(String pluginName, StateBinding stateBinding, String version, JsxElement element) {
        this.pluginName = pluginName;
        this.stateBinding = stateBinding;
        this.version = version;
        this.element = element;
    }

    public enum BindingKind {
        IDENTIFIER,
        MEMBER_EXPRESSION,
        OBJECT_EXPRESSION,
        COMPLEX_EXPRESSION
    }

    public static class StateBinding {
        public BindingKind kind;
        public String name;
        public String binding;
        public String stateType;
        public Expression expression;

        public StateBinding(BindingKind kind, String name, String binding, String stateType, Expression expression) {
            this.kind = kind;
            this.name = name;
            this.binding = binding;
            this.stateType = stateType;
            this.expression = expression;
        }
    }
}
