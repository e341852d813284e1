package org.dxworks.jsxframe.templates;

import org.dxworks.jsxframe.ast.AstHelper;
import org.dxworks.jsxframe.ast.BinaryExpression;
import org.dxworks.jsxframe.ast.CallExpression;
import org.dxworks.jsxframe.ast.ConditionalExpression;
import org.dxworks.jsxframe.ast.Expression;
import org.dxworks.jsxframe.ast.Identifier;
import org.dxworks.jsxframe.ast.JsxChild;
import org.dxworks.jsxframe.ast.JsxElement;
import org.dxworks.jsxframe.ast.JsxEmptyExpression;
import org.dxworks.jsxframe.ast.JsxExpressionContainer;
import org.dxworks.jsxframe.ast.JsxText;
import org.dxworks.jsxframe.ast.LogicalExpression;
import org.dxworks.jsxframe.ast.MemberExpression;
import org.dxworks.jsxframe.ast.UnaryExpression;
import org.dxworks.jsxframe.model.Template;
import org.dxworks.jsxframe.model.Transform;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds one text template per run of literal text and value expressions inside an element.
 * Keys follow {@code <parent indices>.<tag>[i].text[j]}; the runtime depends on this scheme.
 */
public class TextTemplateExtractor extends ElementPathWalker {

    static final String COMPLEX = "__complex__";

    static final Set<String> TRANSFORM_METHODS =
            Set.of("toFixed", "toString", "toLowerCase", "toUpperCase", "trim", "trimStart", "trimEnd");

    private final Map<String, Template> templates = new LinkedHashMap<>();

    private TextTemplateExtractor() {
    }

    public static Map<String, Template> extract(Expression renderBody) {
        TextTemplateExtractor extractor = new TextTemplateExtractor();
        extractor.walk(renderBody);
        return extractor.templates;
    }

    @Override
    protected void visitElement(JsxElement element, int index, List<Integer> parentPath, List<Integer> path) {
        String key = pathKey(element.name, index, parentPath);
        int textIndex = 0;
        List<JsxChild> run = new ArrayList<>();
        for (JsxChild child : element.children) {
            if (child instanceof JsxText) {
                run.add(child);
            } else if (child instanceof JsxExpressionContainer container) {
                if (container.isEmpty()) {
                    continue;
                }
                if (isStructural(container.expression)) {
                    textIndex = flush(run, key, path, textIndex);
                } else {
                    run.add(child);
                }
            } else {
                textIndex = flush(run, key, path, textIndex);
            }
        }
        flush(run, key, path, textIndex);
        visitChildrenOf(element, path);
    }

    private int flush(List<JsxChild> run, String key, List<Integer> path, int textIndex) {
        if (run.isEmpty()) {
            return textIndex;
        }
        Template template = build(run);
        run.clear();
        if (template == null) {
            return textIndex;
        }
        template.path = append(path, textIndex);
        templates.put(key + ".text[" + textIndex + "]", template);
        return textIndex + 1;
    }

    /**
     * JSX-producing children change the DOM shape and belong to structural or loop templates.
     */
    static boolean isStructural(Expression expr) {
        if (AstHelper.isJsx(expr) || expr instanceof JsxEmptyExpression || AstHelper.isMethodCall(expr, "map")) {
            return true;
        }
        if (expr instanceof LogicalExpression logical) {
            return AstHelper.isJsx(logical.right);
        }
        if (expr instanceof ConditionalExpression cond) {
            return AstHelper.isJsx(cond.consequent) || AstHelper.isJsx(cond.alternate);
        }
        return false;
    }

    private static Template build(List<JsxChild> run) {
        StringBuilder text = new StringBuilder();
        Template template = new Template();
        boolean hasExpressions = false;
        boolean nullable = false;

        for (JsxChild child : run) {
            if (child instanceof JsxText jsxText) {
                text.append(jsxText.value);
                continue;
            }
            hasExpressions = true;
            Binding binding = binding(((JsxExpressionContainer) child).expression);
            template.slots.add(text.length());
            text.append('{').append(template.bindings.size()).append('}');
            template.bindings.add(binding.path);
            if (binding.conditionalTemplates != null) {
                template.conditionalTemplates = binding.conditionalTemplates;
            }
            if (binding.transform != null) {
                template.transform = binding.transform;
            }
            nullable |= binding.nullable;
        }

        String raw = text.toString();
        String trimmed = raw.strip();
        if (!hasExpressions) {
            if (trimmed.isEmpty()) {
                return null;
            }
            template.template = trimmed;
            template.type = "static";
            return template;
        }

        int leading = raw.length() - raw.stripLeading().length();
        template.slots.replaceAll(slot -> slot - leading);
        template.template = trimmed;
        if (nullable) {
            template.nullable = true;
        }
        if (template.conditionalTemplates != null) {
            template.type = "conditional";
        } else if (template.transform != null) {
            template.type = "transform";
        } else if (nullable) {
            template.type = "nullable";
        } else {
            template.type = "dynamic";
        }
        return template;
    }

    static class Binding {
        final String path;
        Map<String, Object> conditionalTemplates;
        Transform transform;
        boolean nullable;

        Binding(String path) {
            this.path = path;
        }
    }

    static Binding binding(Expression expr) {
        if (expr instanceof Identifier id) {
            return new Binding(id.name);
        }
        if (expr instanceof MemberExpression) {
            if (AstHelper.isOptionalChain(expr)) {
                String path = AstHelper.strictMemberPath(expr);
                if (path == null) {
                    return new Binding(COMPLEX);
                }
                Binding binding = new Binding(path);
                binding.nullable = true;
                return binding;
            }
            String path = AstHelper.memberPath(expr);
            return new Binding(path != null ? path : COMPLEX);
        }
        if (expr instanceof CallExpression call) {
            return methodCallBinding(call);
        }
        if (expr instanceof BinaryExpression || expr instanceof UnaryExpression) {
            List<String> identifiers = new ArrayList<>();
            AstHelper.collectIdentifiers(expr, identifiers);
            // several sources cannot be expressed as one binding path
            return new Binding(identifiers.size() == 1 ? identifiers.get(0) : COMPLEX);
        }
        if (expr instanceof ConditionalExpression cond) {
            return conditionalBinding(cond);
        }
        return new Binding(COMPLEX);
    }

    private static Binding methodCallBinding(CallExpression call) {
        String method = AstHelper.methodName(call);
        if (method == null || !TRANSFORM_METHODS.contains(method)) {
            return new Binding(COMPLEX);
        }
        String path = AstHelper.bindingPath(((MemberExpression) call.callee).object);
        if (path == null) {
            return new Binding(COMPLEX);
        }
        List<Object> args = new ArrayList<>();
        for (Expression argument : call.arguments) {
            Object value = AstHelper.literalValue(argument);
            if (value != null) {
                args.add(value);
            }
        }
        Binding binding = new Binding(path);
        binding.transform = Transform.methodCall(method, args);
        return binding;
    }

    private static Binding conditionalBinding(ConditionalExpression cond) {
        if (!(cond.test instanceof Identifier test)) {
            return new Binding(COMPLEX);
        }
        String whenTrue = AstHelper.literalText(cond.consequent);
        String whenFalse = AstHelper.literalText(cond.alternate);
        if (whenTrue == null || whenFalse == null) {
            return new Binding(COMPLEX);
        }
        Binding binding = new Binding(test.name);
        binding.conditionalTemplates = new LinkedHashMap<>();
        binding.conditionalTemplates.put("true", whenTrue);
        binding.conditionalTemplates.put("false", whenFalse);
        return binding;
    }
}
