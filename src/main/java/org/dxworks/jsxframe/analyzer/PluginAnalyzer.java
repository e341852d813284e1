package org.dxworks.jsxframe.analyzer;

import org.dxworks.jsxframe.ast.AstHelper;
import org.dxworks.jsxframe.ast.Expression;
import org.dxworks.jsxframe.ast.Identifier;
import org.dxworks.jsxframe.ast.JsxAttribute;
import org.dxworks.jsxframe.ast.JsxElement;
import org.dxworks.jsxframe.ast.JsxExpressionContainer;
import org.dxworks.jsxframe.ast.MemberExpression;
import org.dxworks.jsxframe.ast.Node;
import org.dxworks.jsxframe.ast.ObjectExpression;
import org.dxworks.jsxframe.ast.StringLiteral;
import org.dxworks.jsxframe.compiler.CompilerContext;
import org.dxworks.jsxframe.compiler.Diagnostics;
import org.dxworks.jsxframe.compiler.StructuralValidationException;
import org.dxworks.jsxframe.model.ComponentDescriptor;
import org.dxworks.jsxframe.model.LocalVariable;
import org.dxworks.jsxframe.model.PluginUsage;
import org.dxworks.jsxframe.model.PluginUsage.BindingKind;
import org.dxworks.jsxframe.model.PluginUsage.StateBinding;
import org.dxworks.jsxframe.model.PropInfo;
import org.dxworks.jsxframe.model.StateInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Finds {@code <Plugin name="..." state={...} />} elements and validates them. A plugin element
 * without a usable name or state fails the whole component.
 */
public class PluginAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(PluginAnalyzer.class);

    static final String INLINE_OBJECT = "__inline_object__";
    static final String COMPLEX = "__complex__";

    private static final Pattern PLUGIN_NAME = Pattern.compile("^[A-Za-z][A-Za-z0-9]*$");
    private static final Pattern SEMVER = Pattern.compile("^\\d+\\.\\d+\\.\\d+$");

    private final CompilerContext context;

    public PluginAnalyzer(CompilerContext context) {
        this.context = context;
    }

    public List<PluginUsage> analyze(Node root) {
        List<PluginUsage> usages = new ArrayList<>();
        AstHelper.walk(root, node -> {
            if (node instanceof JsxElement element && AstHelper.isPluginElement(element)) {
                PluginUsage usage = extract(element);
                log.debug("[{}] Found plugin usage: {}", context.componentName(), usage.pluginName);
                usages.add(usage);
            }
        });
        validate(usages);
        return usages;
    }

    private PluginUsage extract(JsxElement element) {
        JsxAttribute nameAttr = element.attribute("name");
        JsxAttribute stateAttr = element.attribute("state");
        JsxAttribute versionAttr = element.attribute("version");

        if (nameAttr == null) {
            throw new StructuralValidationException("Plugin element requires \"name\" attribute");
        }
        if (stateAttr == null) {
            throw new StructuralValidationException("Plugin element requires \"state\" attribute");
        }

        String pluginName = stringValue(nameAttr);
        if (pluginName == null) {
            throw new StructuralValidationException(
                    "Plugin \"name\" attribute must be a string literal (e.g., name=\"Clock\")");
        }
        String version = versionAttr != null ? stringValue(versionAttr) : null;
        return new PluginUsage(pluginName, stateBinding(stateAttr), version, element);
    }

    private StateBinding stateBinding(JsxAttribute stateAttr) {
        if (!(stateAttr.value instanceof JsxExpressionContainer) || stateAttr.expression() == null) {
            throw new StructuralValidationException(
                    "Plugin \"state\" attribute must be a JSX expression (e.g., state={currentTime})");
        }
        Expression expr = stateAttr.expression();

        if (expr instanceof Identifier id) {
            return new StateBinding(BindingKind.IDENTIFIER, id.name, id.name, inferStateType(id.name), expr);
        }
        if (expr instanceof MemberExpression) {
            String binding = bindingPath(expr);
            return new StateBinding(BindingKind.MEMBER_EXPRESSION, null, binding, inferStateType(binding), expr);
        }
        if (expr instanceof ObjectExpression) {
            return new StateBinding(BindingKind.OBJECT_EXPRESSION, null, INLINE_OBJECT, null, expr);
        }
        return new StateBinding(BindingKind.COMPLEX_EXPRESSION, null, COMPLEX, null, expr);
    }

    private void validate(List<PluginUsage> usages) {
        for (PluginUsage usage : usages) {
            if (!PLUGIN_NAME.matcher(usage.pluginName).matches()) {
                throw new StructuralValidationException("Invalid plugin name \"" + usage.pluginName + "\". "
                        + "Plugin names must start with a letter and contain only letters and numbers.");
            }
            if (COMPLEX.equals(usage.stateBinding.binding)) {
                context.warn(Diagnostics.PLUGIN, "Complex expression used for plugin \"" + usage.pluginName
                        + "\" state. This will be evaluated at runtime.");
            }
            if (usage.version != null && !SEMVER.matcher(usage.version).matches()) {
                context.warn(Diagnostics.PLUGIN, "Invalid semver format for plugin \"" + usage.pluginName
                        + "\": " + usage.version);
            }
        }
    }

    /**
     * {@code this.state.time} gives {@code state.time}; computed links are dropped.
     */
    static String bindingPath(Expression expr) {
        String path = AstHelper.memberPath(expr);
        if (path == null) {
            return "";
        }
        if (path.equals("this")) {
            return "";
        }
        return path.startsWith("this.") ? path.substring("this.".length()) : path;
    }

    private String inferStateType(String binding) {
        ComponentDescriptor component = context.component();
        for (StateInfo state : component.useState) {
            if (binding.equals(state.name) || binding.equals(state.setter)) {
                return state.type != null ? state.type : "object";
            }
        }
        for (PropInfo prop : component.props) {
            if (binding.equals(prop.name)) {
                return prop.type != null ? prop.type : "object";
            }
        }
        for (LocalVariable local : component.localVariables) {
            if (binding.equals(local.name)) {
                return local.type != null ? local.type : "object";
            }
        }
        return "object";
    }

    private static String stringValue(JsxAttribute attr) {
        if (attr.value instanceof StringLiteral str) {
            return str.value;
        }
        if (attr.expression() instanceof StringLiteral str) {
            return str.value;
        }
        return null;
    }
}
