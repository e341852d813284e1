package org.dxworks.jsxframe.generator;

import org.dxworks.jsxframe.analyzer.DependencyAnalyzer;
import org.dxworks.jsxframe.analyzer.ZoneClassifier;
import org.dxworks.jsxframe.ast.AstHelper;
import org.dxworks.jsxframe.ast.BlockStatement;
import org.dxworks.jsxframe.ast.CallExpression;
import org.dxworks.jsxframe.ast.ConditionalExpression;
import org.dxworks.jsxframe.ast.Expression;
import org.dxworks.jsxframe.ast.FunctionExpression;
import org.dxworks.jsxframe.ast.Identifier;
import org.dxworks.jsxframe.ast.JsxAttribute;
import org.dxworks.jsxframe.ast.JsxAttributeItem;
import org.dxworks.jsxframe.ast.JsxChild;
import org.dxworks.jsxframe.ast.JsxElement;
import org.dxworks.jsxframe.ast.JsxExpressionContainer;
import org.dxworks.jsxframe.ast.JsxFragment;
import org.dxworks.jsxframe.ast.JsxSpreadAttribute;
import org.dxworks.jsxframe.ast.JsxText;
import org.dxworks.jsxframe.ast.LogicalExpression;
import org.dxworks.jsxframe.ast.MemberExpression;
import org.dxworks.jsxframe.ast.ObjectExpression;
import org.dxworks.jsxframe.ast.ReturnStatement;
import org.dxworks.jsxframe.ast.Statement;
import org.dxworks.jsxframe.ast.StringLiteral;
import org.dxworks.jsxframe.compiler.CompilerContext;
import org.dxworks.jsxframe.compiler.StructuralValidationException;
import org.dxworks.jsxframe.model.ComponentDescriptor;
import org.dxworks.jsxframe.model.PluginUsage;
import org.dxworks.jsxframe.model.Zone;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the virtual-node construction code for JSX. Elements are constructed directly
 * ({@code new VElement(...)}) unless spread props, conditional props or dynamic children
 * require the runtime helper.
 */
public class JsxGenerator {

    enum ChildKind {
        TEXT,
        ELEMENT,
        EXPRESSION
    }

    record ChildCode(ChildKind kind, String code) {
    }

    private final CompilerContext context;
    private final ExpressionGenerator expressions;
    private final RuntimeHelperGenerator runtimeHelpers;
    private final PluginNodeGenerator plugins;

    public JsxGenerator(CompilerContext context, ExpressionGenerator expressions) {
        this.context = context;
        this.expressions = expressions;
        this.runtimeHelpers = new RuntimeHelperGenerator(this, expressions);
        this.plugins = new PluginNodeGenerator(expressions);
    }

    ExpressionGenerator expressions() {
        return expressions;
    }

    ComponentDescriptor component() {
        return context.component();
    }

    /**
     * Elements and fragments become nodes; any other expression is translated as a value.
     */
    public String generateNode(Expression node, int indent) {
        if (node instanceof JsxElement element) {
            return generateElement(element, indent);
        }
        if (node instanceof JsxFragment fragment) {
            return generateFragment(fragment, indent);
        }
        return expressions.generate(node);
    }

    public String generateFragment(JsxFragment fragment, int indent) {
        String children = generateChildren(fragment.children, indent).stream()
                .map(ChildCode::code)
                .collect(Collectors.joining(", "));
        return "new Fragment(" + children + ")";
    }

    public String generateElement(JsxElement element, int indent) {
        if (AstHelper.isPluginElement(element)) {
            return plugins.generate(pluginUsageFor(element));
        }

        String markdown = markdownElement(element);
        if (markdown != null) {
            return markdown;
        }

        if (needsRuntimeHelper(element)) {
            return runtimeHelpers.generateCall(element, indent);
        }

        String ind = CSharpStrings.indentLevel(indent);
        List<String> props = new ArrayList<>();
        List<String> handlers = new ArrayList<>();
        List<String> minimactAttrs = new ArrayList<>();

        for (JsxAttributeItem item : element.attributes) {
            if (!(item instanceof JsxAttribute attr)) {
                continue;
            }
            String name = attr.name;
            String htmlName = name.equals("className") ? "class" : name;

            if (name.startsWith("on")) {
                handlers.add("[\"" + name.toLowerCase() + "\"] = \"" + handlerName(attr) + "\"");
            } else if (name.startsWith("data-minimact-")) {
                String value = attr.value instanceof StringLiteral str ? str.value : expressions.generate(attr.expression());
                minimactAttrs.add("[\"" + htmlName + "\"] = \"" + value + "\"");
            } else if (attr.value instanceof StringLiteral str) {
                props.add("[\"" + htmlName + "\"] = " + CSharpStrings.quote(str.value));
            } else if (attr.value instanceof JsxExpressionContainer) {
                Expression expr = attr.expression();
                if (name.equals("style") && expr instanceof ObjectExpression style) {
                    props.add("[\"style\"] = \"" + StyleConverter.toCss(style) + "\"");
                } else {
                    props.add("[\"" + htmlName + "\"] = $\"{" + expressions.generate(expr) + "}\"");
                }
            } else {
                props.add("[\"" + htmlName + "\"] = \"\"");
            }
        }

        List<String> all = new ArrayList<>(props);
        all.addAll(handlers);
        all.addAll(minimactAttrs);
        String propsCode = all.isEmpty()
                ? "new Dictionary<string, string>()"
                : "new Dictionary<string, string> { " + String.join(", ", all) + " }";

        List<ChildCode> children = generateChildren(element.children, indent);
        String tag = element.name;
        if (children.isEmpty()) {
            return "new VElement(\"" + tag + "\", " + propsCode + ")";
        }
        if (children.size() == 1 && children.get(0).kind() == ChildKind.TEXT) {
            return "new VElement(\"" + tag + "\", " + propsCode + ", " + children.get(0).code() + ")";
        }
        String childrenArray = children.stream()
                .map(JsxGenerator::asNode)
                .collect(Collectors.joining(",\n" + ind + "    "));
        return "new VElement(\"" + tag + "\", " + propsCode + ", new VNode[]\n" + ind + "{\n" + ind + "    "
                + childrenArray + "\n" + ind + "})";
    }

    private static String asNode(ChildCode child) {
        switch (child.kind()) {
            case TEXT:
                return "new VText(" + child.code() + ")";
            case EXPRESSION:
                return "new VText($\"{(" + child.code() + ")}\")";
            default:
                return child.code();
        }
    }

    List<ChildCode> generateChildren(List<JsxChild> children, int indent) {
        List<ChildCode> result = new ArrayList<>();
        for (JsxChild child : children) {
            if (child instanceof JsxText text) {
                String trimmed = text.value.strip();
                if (!trimmed.isEmpty()) {
                    result.add(new ChildCode(ChildKind.TEXT, CSharpStrings.quote(trimmed)));
                }
            } else if (child instanceof JsxElement element) {
                result.add(new ChildCode(ChildKind.ELEMENT, generateElement(element, indent + 1)));
            } else if (child instanceof JsxFragment fragment) {
                result.add(new ChildCode(ChildKind.ELEMENT, generateFragment(fragment, indent + 1)));
            } else if (child instanceof JsxExpressionContainer container && !container.isEmpty()) {
                result.add(new ChildCode(ChildKind.EXPRESSION, generateJsxExpression(container.expression, indent)));
            }
        }
        return result;
    }

    /**
     * An embedded {@code {expr}}: ternaries and {@code &&} with JSX branches go through the runtime
     * helper, {@code .map} becomes {@code Select}, mixed client/server reads are wrapped in a
     * {@code VText}.
     */
    public String generateJsxExpression(Expression expr, int indent) {
        Zone zone = ZoneClassifier.classify(DependencyAnalyzer.analyze(expr, component().stateTypes));
        if (zone == Zone.HYBRID) {
            return "new VText(" + expressions.generate(expr) + ")";
        }

        if (expr instanceof ConditionalExpression cond) {
            String condition = expressions.generateBoolean(cond.test);
            return "(" + condition + ") ? " + helperOrValue(cond.consequent, indent) + " : "
                    + helperOrValue(cond.alternate, indent);
        }
        if (expr instanceof LogicalExpression logical && logical.isAnd()) {
            String left = expressions.generateBoolean(logical.left);
            return "(" + left + ") ? " + helperOrValue(logical.right, indent) + " : null";
        }
        if (isMapCall(expr)) {
            return generateMapExpression((CallExpression) expr, indent);
        }
        return expressions.generate(expr);
    }

    private String helperOrValue(Expression expr, int indent) {
        return AstHelper.isJsx(expr) ? runtimeHelpers.generateForNode(expr, indent) : expressions.generate(expr);
    }

    /**
     * {@code items.map((item, i) => <li/>)} as {@code items.Select((item, i) => ...).ToArray()}.
     */
    public String generateMapExpression(CallExpression call, int indent) {
        MemberExpression callee = (MemberExpression) call.callee;
        if (!(call.argument(0) instanceof FunctionExpression callback)) {
            return expressions.generate(call);
        }

        String arrayName = callee.object instanceof Identifier id ? id.name : expressions.generate(callee.object);
        String itemParam = callback.params.isEmpty() ? "item" : paramName(callback, 0);
        String indexParam = callback.params.size() > 1 ? paramName(callback, 1) : null;
        String itemCode = itemCode(callback, indent + 1);

        if (indexParam != null) {
            return arrayName + ".Select((" + itemParam + ", " + indexParam + ") => " + itemCode + ").ToArray()";
        }
        return arrayName + ".Select(" + itemParam + " => " + itemCode + ").ToArray()";
    }

    private String itemCode(FunctionExpression callback, int indent) {
        if (callback.body instanceof BlockStatement block) {
            Expression returned = null;
            for (Statement statement : block.body) {
                if (statement instanceof ReturnStatement ret) {
                    returned = ret.argument;
                }
            }
            return generateNode(returned, indent);
        }
        Expression body = (Expression) callback.body;
        return AstHelper.isJsx(body) ? generateNode(body, indent) : generateJsxExpression(body, indent);
    }

    private static String paramName(FunctionExpression callback, int index) {
        return callback.params.get(index) instanceof Identifier id ? id.name : "_" + index;
    }

    static boolean isMapCall(Expression expr) {
        return expr instanceof CallExpression call
                && call.callee instanceof MemberExpression member
                && "map".equals(member.propertyName());
    }

    String handlerName(JsxAttribute attr) {
        return component().handlerNames.getOrDefault(attr, "UnknownHandler");
    }

    PluginUsage pluginUsageFor(JsxElement element) {
        List<PluginUsage> usages = component().pluginUsages;
        for (PluginUsage usage : usages) {
            if (usage.element == element) {
                return usage;
            }
        }
        throw new StructuralValidationException("Plugin metadata not found for <" + element.name + "> element");
    }

    private String markdownElement(JsxElement element) {
        if (element.attribute("markdown") == null || element.children.size() != 1) {
            return null;
        }
        if (element.children.get(0) instanceof JsxExpressionContainer container
                && container.expression instanceof Identifier id
                && component().stateTypes.get(id.name) == Zone.MARKDOWN) {
            return "new DivRawHtml(MarkdownHelper.ToHtml(" + id.name + "))";
        }
        return null;
    }

    /**
     * Spread attributes, conditional attribute values, or children that map, select or branch
     * into JSX need runtime prop merging and branch selection.
     */
    static boolean needsRuntimeHelper(JsxElement element) {
        return hasSpreadProps(element) || hasDynamicChildren(element) || hasComplexProps(element);
    }

    static boolean hasSpreadProps(JsxElement element) {
        return element.attributes.stream().anyMatch(a -> a instanceof JsxSpreadAttribute);
    }

    static boolean hasComplexProps(JsxElement element) {
        for (JsxAttributeItem item : element.attributes) {
            if (item instanceof JsxAttribute attr) {
                Expression expr = attr.expression();
                if (expr instanceof ConditionalExpression || expr instanceof LogicalExpression) {
                    return true;
                }
            }
        }
        return false;
    }

    static boolean hasDynamicChildren(JsxElement element) {
        for (JsxChild child : element.children) {
            if (!(child instanceof JsxExpressionContainer container)) {
                continue;
            }
            Expression expr = container.expression;
            if (expr instanceof CallExpression call && call.callee instanceof MemberExpression member) {
                String method = member.propertyName();
                if ("map".equals(method) || "Select".equals(method) || "ToArray".equals(method)) {
                    return true;
                }
            }
            if (expr instanceof ConditionalExpression cond
                    && (AstHelper.isJsx(cond.consequent) || AstHelper.isJsx(cond.alternate))) {
                return true;
            }
            if (expr instanceof LogicalExpression logical && AstHelper.isJsx(logical.right)) {
                return true;
            }
        }
        return false;
    }
}
