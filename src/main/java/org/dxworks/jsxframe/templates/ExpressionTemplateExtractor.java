package org.dxworks.jsxframe.templates;

import org.dxworks.jsxframe.ast.AstHelper;
import org.dxworks.jsxframe.ast.BinaryExpression;
import org.dxworks.jsxframe.ast.CallExpression;
import org.dxworks.jsxframe.ast.ConditionalExpression;
import org.dxworks.jsxframe.ast.Expression;
import org.dxworks.jsxframe.ast.Identifier;
import org.dxworks.jsxframe.ast.JsxAttribute;
import org.dxworks.jsxframe.ast.JsxAttributeItem;
import org.dxworks.jsxframe.ast.JsxChild;
import org.dxworks.jsxframe.ast.JsxElement;
import org.dxworks.jsxframe.ast.JsxExpressionContainer;
import org.dxworks.jsxframe.ast.JsxFragment;
import org.dxworks.jsxframe.ast.LogicalExpression;
import org.dxworks.jsxframe.ast.MemberExpression;
import org.dxworks.jsxframe.ast.NumericLiteral;
import org.dxworks.jsxframe.ast.UnaryExpression;
import org.dxworks.jsxframe.compiler.CompilerContext;
import org.dxworks.jsxframe.model.ExpressionTemplate;
import org.dxworks.jsxframe.model.Transform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computed values a runtime can recompute from fresh state: whitelisted method calls,
 * {@code .length}, sign flips and single-variable arithmetic with literal operands.
 * Anything with several variables is kept as an informational formula.
 */
public class ExpressionTemplateExtractor {
    private static final Logger log = LoggerFactory.getLogger(ExpressionTemplateExtractor.class);

    static final Map<String, String> SUPPORTED_TRANSFORMS = Map.ofEntries(
            Map.entry("toFixed", "numberFormat"),
            Map.entry("toPrecision", "numberFormat"),
            Map.entry("toExponential", "numberFormat"),
            Map.entry("toUpperCase", "stringTransform"),
            Map.entry("toLowerCase", "stringTransform"),
            Map.entry("trim", "stringTransform"),
            Map.entry("substring", "stringTransform"),
            Map.entry("substr", "stringTransform"),
            Map.entry("slice", "stringTransform"),
            Map.entry("length", "property"),
            Map.entry("join", "arrayTransform"));

    private final CompilerContext context;
    private final List<ExpressionTemplate> templates = new ArrayList<>();

    public ExpressionTemplateExtractor(CompilerContext context) {
        this.context = context;
    }

    public List<ExpressionTemplate> extract(Expression renderBody) {
        templates.clear();
        if (renderBody instanceof JsxElement || renderBody instanceof JsxFragment) {
            traverse(renderBody, List.of());
        }
        return new ArrayList<>(templates);
    }

    private void traverse(Expression node, List<Integer> path) {
        List<JsxChild> children;
        if (node instanceof JsxElement element) {
            children = element.children;
        } else if (node instanceof JsxFragment fragment) {
            children = fragment.children;
        } else {
            return;
        }

        for (int i = 0; i < children.size(); i++) {
            JsxChild child = children.get(i);
            List<Integer> childPath = ElementPathWalker.append(path, i);
            if (child instanceof JsxExpressionContainer container && !container.isEmpty()) {
                add(template(container.expression, childPath), null);
            } else if (child instanceof JsxElement || child instanceof JsxFragment) {
                traverse((Expression) child, childPath);
            }
        }

        if (node instanceof JsxElement element) {
            for (JsxAttributeItem item : element.attributes) {
                if (item instanceof JsxAttribute attr && attr.expression() != null) {
                    add(template(attr.expression(), path), attr.name);
                }
            }
        }
    }

    private void add(ExpressionTemplate template, String attribute) {
        if (template != null) {
            template.attribute = attribute;
            templates.add(template);
        }
    }

    ExpressionTemplate template(Expression expr, List<Integer> path) {
        // plain identifiers are text bindings, conditionals are structural
        if (expr instanceof Identifier || expr instanceof ConditionalExpression || expr instanceof LogicalExpression) {
            return null;
        }
        ExpressionTemplate template = null;
        if (expr instanceof CallExpression call && call.callee instanceof MemberExpression callee) {
            template = methodCall(call, callee);
        } else if (expr instanceof BinaryExpression binary) {
            template = binary(binary);
        } else if (expr instanceof MemberExpression member) {
            template = member(member);
        } else if (expr instanceof UnaryExpression unary) {
            template = unary(unary);
        }
        if (template != null) {
            template.path = path;
        }
        return template;
    }

    private ExpressionTemplate methodCall(CallExpression call, MemberExpression callee) {
        String binding = AstHelper.bindingPath(callee.object);
        String method = callee.propertyName();
        if (binding == null || method == null) {
            return null;
        }
        if (!SUPPORTED_TRANSFORMS.containsKey(method) || method.equals("length")) {
            log.debug("[{}] Unsupported method in expression template: {}", context.componentName(), method);
            return null;
        }

        List<Object> args = new ArrayList<>();
        for (Expression argument : call.arguments) {
            Object value = AstHelper.literalValue(argument);
            if (value != null) {
                args.add(value);
            }
        }

        ExpressionTemplate template = new ExpressionTemplate();
        template.type = "methodCall";
        template.stateKey = stateKey(callee.object, binding);
        template.binding = binding;
        template.method = method;
        template.args = args;
        template.transform = Transform.of(SUPPORTED_TRANSFORMS.get(method), method, args);
        return template;
    }

    private ExpressionTemplate binary(BinaryExpression binary) {
        List<String> identifiers = new ArrayList<>();
        collectIdentifiers(binary, identifiers);
        if (identifiers.isEmpty()) {
            return null;
        }

        ExpressionTemplate template = new ExpressionTemplate();
        template.stateKey = identifiers.get(0).split("\\.")[0];
        if (identifiers.size() == 1) {
            List<Map<String, Object>> operations = new ArrayList<>();
            arithmetic(binary, identifiers.get(0), operations);
            if (!operations.isEmpty()) {
                template.type = "binaryExpression";
                template.bindings = identifiers;
                template.transform = new Transform();
                template.transform.type = "arithmetic";
                template.transform.operations = operations;
                return template;
            }
        }

        template.type = "complexExpression";
        template.bindings = identifiers;
        template.expression = formula(binary);
        return template;
    }

    /**
     * Records {@code op literal} steps applied to the target binding, innermost first.
     */
    private static void arithmetic(Expression node, String target, List<Map<String, Object>> operations) {
        if (!(node instanceof BinaryExpression binary)) {
            return;
        }
        boolean leftIsTarget = target.equals(AstHelper.bindingPath(binary.left));
        boolean rightIsTarget = target.equals(AstHelper.bindingPath(binary.right));
        if (leftIsTarget && binary.right instanceof NumericLiteral) {
            operations.add(operation(binary.operator, AstHelper.literalValue(binary.right), "right"));
        } else if (rightIsTarget && binary.left instanceof NumericLiteral) {
            operations.add(operation(binary.operator, AstHelper.literalValue(binary.left), "left"));
        } else {
            arithmetic(binary.left, target, operations);
            arithmetic(binary.right, target, operations);
        }
    }

    private static Map<String, Object> operation(String operator, Object value, String side) {
        Map<String, Object> operation = new LinkedHashMap<>();
        operation.put("op", operator);
        operation.put("value", value);
        operation.put("side", side);
        return operation;
    }

    private ExpressionTemplate member(MemberExpression member) {
        String property = member.propertyName();
        if (property == null || !"property".equals(SUPPORTED_TRANSFORMS.get(property))) {
            return null;
        }
        String binding = AstHelper.memberPath(member);
        if (binding == null) {
            return null;
        }

        ExpressionTemplate template = new ExpressionTemplate();
        template.type = "memberExpression";
        template.stateKey = stateKey(member, binding.split("\\.")[0]);
        template.binding = binding;
        template.property = property;
        template.transform = new Transform();
        template.transform.type = "property";
        template.transform.property = property;
        return template;
    }

    private ExpressionTemplate unary(UnaryExpression unary) {
        if (!unary.operator.equals("-") && !unary.operator.equals("+")) {
            return null;
        }
        String binding = AstHelper.bindingPath(unary.argument);
        if (binding == null) {
            return null;
        }

        ExpressionTemplate template = new ExpressionTemplate();
        template.type = "unaryExpression";
        template.stateKey = stateKey(unary.argument, binding);
        template.binding = binding;
        template.operator = unary.operator;
        template.transform = new Transform();
        template.transform.type = "unary";
        template.transform.operator = unary.operator;
        return template;
    }

    private static String stateKey(Expression expr, String fallback) {
        Expression current = expr;
        while (current instanceof MemberExpression member) {
            current = member.object;
        }
        return current instanceof Identifier id ? id.name : fallback;
    }

    private static void collectIdentifiers(Expression expr, List<String> result) {
        if (expr instanceof Identifier id) {
            result.add(id.name);
        } else if (expr instanceof BinaryExpression binary) {
            collectIdentifiers(binary.left, result);
            collectIdentifiers(binary.right, result);
        } else if (expr instanceof UnaryExpression unary) {
            collectIdentifiers(unary.argument, result);
        } else if (expr instanceof MemberExpression) {
            String path = AstHelper.memberPath(expr);
            if (path != null) {
                result.add(path);
            }
        }
    }

    static String formula(Expression expr) {
        if (expr instanceof Identifier id) {
            return id.name;
        }
        if (expr instanceof NumericLiteral num) {
            return AstHelper.formatNumber(num.value);
        }
        if (expr instanceof BinaryExpression binary) {
            return formula(binary.left) + " " + binary.operator + " " + formula(binary.right);
        }
        if (expr instanceof UnaryExpression unary) {
            return unary.operator + formula(unary.argument);
        }
        if (expr instanceof MemberExpression) {
            String path = AstHelper.memberPath(expr);
            return path != null ? path : "?";
        }
        return "?";
    }
}
