package org.dxworks.jsxframe.templates;

import org.dxworks.jsxframe.ast.AstHelper;
import org.dxworks.jsxframe.ast.ConditionalExpression;
import org.dxworks.jsxframe.ast.Expression;
import org.dxworks.jsxframe.ast.Identifier;
import org.dxworks.jsxframe.ast.JsxAttribute;
import org.dxworks.jsxframe.ast.JsxAttributeItem;
import org.dxworks.jsxframe.ast.JsxChild;
import org.dxworks.jsxframe.ast.JsxElement;
import org.dxworks.jsxframe.ast.JsxExpressionContainer;
import org.dxworks.jsxframe.ast.JsxFragment;
import org.dxworks.jsxframe.ast.JsxText;
import org.dxworks.jsxframe.ast.LogicalExpression;
import org.dxworks.jsxframe.ast.MemberExpression;
import org.dxworks.jsxframe.ast.NullLiteral;
import org.dxworks.jsxframe.ast.StringLiteral;
import org.dxworks.jsxframe.ast.UnaryExpression;
import org.dxworks.jsxframe.compiler.CompilerContext;
import org.dxworks.jsxframe.compiler.Diagnostics;
import org.dxworks.jsxframe.model.BranchTemplate;
import org.dxworks.jsxframe.model.StructuralTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ternaries and logical ANDs whose branches render JSX. Paths are child indices from the
 * render root.
 */
public class StructuralTemplateExtractor {

    private final CompilerContext context;
    private final List<StructuralTemplate> templates = new ArrayList<>();

    public StructuralTemplateExtractor(CompilerContext context) {
        this.context = context;
    }

    public List<StructuralTemplate> extract(Expression renderBody) {
        templates.clear();
        if (renderBody instanceof JsxElement element) {
            traverse(element.children, List.of());
        } else if (renderBody instanceof JsxFragment fragment) {
            traverse(fragment.children, List.of());
        }
        return new ArrayList<>(templates);
    }

    private void traverse(List<JsxChild> children, List<Integer> path) {
        for (int i = 0; i < children.size(); i++) {
            JsxChild child = children.get(i);
            List<Integer> childPath = ElementPathWalker.append(path, i);
            if (child instanceof JsxExpressionContainer container) {
                StructuralTemplate template = null;
                if (container.expression instanceof ConditionalExpression cond) {
                    template = conditional(cond, childPath);
                } else if (container.expression instanceof LogicalExpression logical && logical.isAnd()) {
                    template = logicalAnd(logical, childPath);
                }
                if (template != null) {
                    templates.add(template);
                }
            } else if (child instanceof JsxElement element) {
                traverse(element.children, childPath);
            } else if (child instanceof JsxFragment fragment) {
                traverse(fragment.children, childPath);
            }
        }
    }

    private StructuralTemplate conditional(ConditionalExpression cond, List<Integer> path) {
        boolean hasTrue = AstHelper.isJsx(cond.consequent);
        boolean hasFalse = AstHelper.isJsx(cond.alternate) || cond.alternate instanceof NullLiteral;
        if (!hasTrue && !hasFalse) {
            return null;
        }
        String binding = conditionBinding(cond.test);
        if (binding == null) {
            context.warn(Diagnostics.TEMPLATE_EXTRACTION,
                    "[Structural Template] Could not extract binding from ternary condition");
            return null;
        }

        StructuralTemplate template = new StructuralTemplate();
        template.type = "conditional";
        template.stateKey = stateKey(cond.test, binding);
        template.conditionBinding = binding;
        // a branch that renders text or a value is left out
        if (hasTrue) {
            template.branches.put("true", branch(cond.consequent));
        }
        if (hasFalse) {
            template.branches.put("false", cond.alternate instanceof NullLiteral
                    ? BranchTemplate.nullBranch() : branch(cond.alternate));
        }
        template.path = path;
        return template;
    }

    private StructuralTemplate logicalAnd(LogicalExpression logical, List<Integer> path) {
        if (!AstHelper.isJsx(logical.right)) {
            return null;
        }
        String binding = conditionBinding(logical.left);
        if (binding == null) {
            context.warn(Diagnostics.TEMPLATE_EXTRACTION,
                    "[Structural Template] Could not extract binding from logical AND condition");
            return null;
        }

        StructuralTemplate template = new StructuralTemplate();
        template.type = "logicalAnd";
        template.stateKey = stateKey(logical.left, binding);
        template.conditionBinding = binding;
        template.branches.put("truthy", branch(logical.right));
        template.branches.put("falsy", BranchTemplate.nullBranch());
        template.path = path;
        return template;
    }

    /**
     * {@code isLoading}, {@code user.isAdmin} or {@code !isLoading}.
     */
    static String conditionBinding(Expression test) {
        if (test instanceof Identifier id) {
            return id.name;
        }
        if (test instanceof MemberExpression) {
            return AstHelper.memberPath(test);
        }
        if (test instanceof UnaryExpression unary && unary.operator.equals("!")) {
            String binding = conditionBinding(unary.argument);
            return binding != null ? "!" + binding : null;
        }
        return null;
    }

    private static String stateKey(Expression test, String binding) {
        Expression current = test;
        while (current instanceof UnaryExpression unary) {
            current = unary.argument;
        }
        Identifier root = AstHelper.rootIdentifier(current);
        return root != null ? root.name : binding;
    }

    private static BranchTemplate branch(Expression node) {
        if (node instanceof JsxElement element) {
            return element(element);
        }
        JsxFragment fragment = (JsxFragment) node;
        BranchTemplate branch = new BranchTemplate();
        branch.type = "Fragment";
        branch.children = children(fragment.children);
        return branch;
    }

    private static BranchTemplate element(JsxElement element) {
        BranchTemplate branch = new BranchTemplate();
        branch.type = "Element";
        branch.tag = element.name;

        Map<String, Object> props = new LinkedHashMap<>();
        for (JsxAttributeItem item : element.attributes) {
            if (!(item instanceof JsxAttribute attr)) {
                continue;
            }
            if (attr.value instanceof StringLiteral str) {
                props.put(attr.name, str.value);
            } else if (attr.value instanceof JsxExpressionContainer) {
                // dynamic props are re-evaluated by the runtime
                props.put(attr.name, attr.expression() instanceof Identifier id
                        ? Map.of("binding", id.name)
                        : Map.of("expression", true));
            }
        }
        List<BranchTemplate> children = children(element.children);
        branch.props = props.isEmpty() ? null : props;
        branch.children = children.isEmpty() ? null : children;
        return branch;
    }

    private static List<BranchTemplate> children(List<JsxChild> nodes) {
        List<BranchTemplate> children = new ArrayList<>();
        for (JsxChild child : nodes) {
            if (child instanceof JsxElement element) {
                children.add(element(element));
            } else if (child instanceof JsxText text && !text.value.isBlank()) {
                children.add(BranchTemplate.text(text.value.strip()));
            }
        }
        return children;
    }
}
