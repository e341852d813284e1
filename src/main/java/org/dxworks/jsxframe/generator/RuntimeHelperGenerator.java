package org.dxworks.jsxframe.generator;

import org.dxworks.jsxframe.ast.AstHelper;
import org.dxworks.jsxframe.ast.CallExpression;
import org.dxworks.jsxframe.ast.ConditionalExpression;
import org.dxworks.jsxframe.ast.Expression;
import org.dxworks.jsxframe.ast.JsxAttribute;
import org.dxworks.jsxframe.ast.JsxAttributeItem;
import org.dxworks.jsxframe.ast.JsxChild;
import org.dxworks.jsxframe.ast.JsxElement;
import org.dxworks.jsxframe.ast.JsxExpressionContainer;
import org.dxworks.jsxframe.ast.JsxFragment;
import org.dxworks.jsxframe.ast.JsxSpreadAttribute;
import org.dxworks.jsxframe.ast.JsxText;
import org.dxworks.jsxframe.ast.LogicalExpression;
import org.dxworks.jsxframe.ast.ObjectExpression;
import org.dxworks.jsxframe.ast.StringLiteral;

import java.util.ArrayList;
import java.util.List;

/**
 * Emits {@code MinimactHelpers.createElement(tag, props, children...)} for elements whose props
 * or children are only known at runtime.
 */
public class RuntimeHelperGenerator {

    private final JsxGenerator jsx;
    private final ExpressionGenerator expressions;

    RuntimeHelperGenerator(JsxGenerator jsx, ExpressionGenerator expressions) {
        this.jsx = jsx;
        this.expressions = expressions;
    }

    public String generateCall(JsxElement element, int indent) {
        List<String> regularProps = new ArrayList<>();
        List<String> spreadProps = new ArrayList<>();

        for (JsxAttributeItem item : element.attributes) {
            if (item instanceof JsxSpreadAttribute spread) {
                spreadProps.add(expressions.generate(spread.argument));
            } else if (item instanceof JsxAttribute attr) {
                regularProps.add(attr.name + " = " + propValue(attr));
            }
        }

        String propsCode = propsCode(regularProps, spreadProps);

        List<String> children = new ArrayList<>();
        for (JsxChild child : element.children) {
            if (child instanceof JsxText text) {
                String trimmed = text.value.strip();
                if (!trimmed.isEmpty()) {
                    children.add(CSharpStrings.quote(trimmed));
                }
            } else if (child instanceof JsxElement nested) {
                children.add(jsx.generateElement(nested, indent + 1));
            } else if (child instanceof JsxFragment fragment) {
                children.add(jsx.generateFragment(fragment, indent + 1));
            } else if (child instanceof JsxExpressionContainer container && !container.isEmpty()) {
                children.add(dynamicChild(container.expression, indent));
            }
        }

        String call = "MinimactHelpers.createElement(\"" + element.name + "\", " + propsCode;
        if (children.isEmpty()) {
            return call + ")";
        }
        return call + ", " + String.join(", ", children) + ")";
    }

    /**
     * Runtime-helper form of a JSX node used as a conditional branch.
     */
    public String generateForNode(Expression node, int indent) {
        if (node instanceof JsxFragment fragment) {
            List<String> children = new ArrayList<>();
            for (JsxChild child : fragment.children) {
                if (child instanceof JsxText text) {
                    String trimmed = text.value.strip();
                    if (!trimmed.isEmpty()) {
                        children.add(CSharpStrings.quote(trimmed));
                    }
                } else if (child instanceof JsxElement || child instanceof JsxFragment) {
                    children.add(generateForNode((Expression) child, indent + 1));
                } else if (child instanceof JsxExpressionContainer container && !container.isEmpty()) {
                    children.add(expressions.generate(container.expression));
                }
            }
            if (children.isEmpty()) {
                return "MinimactHelpers.Fragment()";
            }
            return "MinimactHelpers.Fragment(" + String.join(", ", children) + ")";
        }
        if (node instanceof JsxElement element) {
            if (AstHelper.isPluginElement(element)) {
                return jsx.generateElement(element, indent);
            }
            return generateCall(element, indent);
        }
        return "null";
    }

    private String propValue(JsxAttribute attr) {
        if (attr.value == null) {
            return "\"true\"";
        }
        if (attr.value instanceof StringLiteral str) {
            return CSharpStrings.quote(str.value);
        }
        if (attr.value instanceof JsxExpressionContainer) {
            Expression expr = attr.expression();
            if (attr.name.equals("style") && expr instanceof ObjectExpression style) {
                return "\"" + StyleConverter.toCss(style) + "\"";
            }
            if (attr.name.startsWith("on") && jsx.component().handlerNames.containsKey(attr)) {
                return "\"" + jsx.handlerName(attr) + "\"";
            }
            return expressions.generate(expr);
        }
        return "null";
    }

    private static String propsCode(List<String> regularProps, List<String> spreadProps) {
        if (!regularProps.isEmpty() && !spreadProps.isEmpty()) {
            String code = "((object)new { " + String.join(", ", regularProps) + " })";
            for (String spread : spreadProps) {
                code = code + ".MergeWith((object)" + spread + ")";
            }
            return code;
        }
        if (!regularProps.isEmpty()) {
            return "new { " + String.join(", ", regularProps) + " }";
        }
        if (!spreadProps.isEmpty()) {
            String code = spreadProps.get(0);
            for (int i = 1; i < spreadProps.size(); i++) {
                code = "((object)" + code + ").MergeWith((object)" + spreadProps.get(i) + ")";
            }
            return code;
        }
        return "null";
    }

    private String dynamicChild(Expression expr, int indent) {
        if (expr instanceof ConditionalExpression cond) {
            String condition = expressions.generateBoolean(cond.test);
            return "(" + condition + ") ? " + branch(cond.consequent, indent) + " : " + branch(cond.alternate, indent);
        }
        if (expr instanceof LogicalExpression logical && logical.isAnd()) {
            String left = expressions.generateBoolean(logical.left);
            return "(" + left + ") ? " + branch(logical.right, indent) + " : null";
        }
        if (JsxGenerator.isMapCall(expr)) {
            return jsx.generateMapExpression((CallExpression) expr, indent);
        }
        return expressions.generate(expr);
    }

    private String branch(Expression expr, int indent) {
        return AstHelper.isJsx(expr) ? jsx.generateNode(expr, indent + 1) : expressions.generate(expr);
    }
}
