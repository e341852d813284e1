package org.dxworks.jsxframe.analyzer;

import org.dxworks.jsxframe.ast.BinaryExpression;
import org.dxworks.jsxframe.ast.BlockStatement;
import org.dxworks.jsxframe.ast.CallExpression;
import org.dxworks.jsxframe.ast.ConditionalExpression;
import org.dxworks.jsxframe.ast.Expression;
import org.dxworks.jsxframe.ast.ExpressionStatement;
import org.dxworks.jsxframe.ast.FunctionExpression;
import org.dxworks.jsxframe.ast.Identifier;
import org.dxworks.jsxframe.ast.JsxAttribute;
import org.dxworks.jsxframe.ast.JsxAttributeItem;
import org.dxworks.jsxframe.ast.JsxChild;
import org.dxworks.jsxframe.ast.JsxElement;
import org.dxworks.jsxframe.ast.JsxExpressionContainer;
import org.dxworks.jsxframe.ast.LogicalExpression;
import org.dxworks.jsxframe.ast.MemberExpression;
import org.dxworks.jsxframe.ast.Node;
import org.dxworks.jsxframe.ast.ReturnStatement;
import org.dxworks.jsxframe.ast.Statement;
import org.dxworks.jsxframe.ast.VariableDeclaration;
import org.dxworks.jsxframe.ast.VariableDeclarator;
import org.dxworks.jsxframe.model.PropInfo;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Narrows {@code dynamic} props from the way the component body uses them. Declared types are
 * never changed.
 */
public class PropTypeInference {

    private static final Set<String> ARRAY_METHODS =
            Set.of("map", "filter", "forEach", "find", "some", "every", "reduce", "sort", "slice");
    private static final Set<String> NUMERIC_OPERATORS =
            Set.of("+", "-", "*", "/", "%", ">", "<", ">=", "<=");

    static class Usage {
        boolean usedAsBoolean;
        boolean usedAsNumber;
        boolean usedAsString;
        boolean usedAsArray;
        boolean usedAsObject;
        boolean hasArrayMethods;
        boolean hasNumberOperations;
    }

    private final Map<String, Usage> usages = new HashMap<>();

    private PropTypeInference(List<PropInfo> props) {
        for (PropInfo prop : props) {
            usages.put(prop.name, new Usage());
        }
    }

    public static void infer(List<PropInfo> props, Node body) {
        PropTypeInference inference = new PropTypeInference(props);
        inference.analyze(body);
        for (PropInfo prop : props) {
            if (prop.type.equals("dynamic")) {
                prop.type = typeFor(inference.usages.get(prop.name));
            }
        }
    }

    static String typeFor(Usage usage) {
        if (usage.hasArrayMethods) {
            return "List<dynamic>";
        }
        if (usage.usedAsArray && !usage.hasNumberOperations) {
            return "List<dynamic>";
        }
        if (usage.usedAsBoolean && !usage.usedAsNumber && !usage.usedAsString
                && !usage.usedAsObject && !usage.usedAsArray) {
            return "bool";
        }
        if (usage.hasNumberOperations && !usage.usedAsBoolean && !usage.usedAsArray) {
            return "double";
        }
        return "dynamic";
    }

    private void analyze(Node node) {
        if (node == null) return;

        if (node instanceof BlockStatement block) {
            for (Statement statement : block.body) {
                analyze(statement);
            }
            return;
        }
        if (node instanceof VariableDeclaration declaration) {
            for (VariableDeclarator declarator : declaration.declarations) {
                analyze(declarator.init);
            }
            return;
        }
        if (node instanceof ReturnStatement ret) {
            analyze(ret.argument);
            return;
        }
        if (node instanceof ExpressionStatement stmt) {
            analyze(stmt.expression);
            return;
        }

        if (node instanceof ConditionalExpression cond) {
            usage(cond.test).ifPresent(u -> u.usedAsBoolean = true);
            analyze(cond.consequent);
            analyze(cond.alternate);
        } else if (node instanceof LogicalExpression logical) {
            usage(logical.left).ifPresent(u -> u.usedAsBoolean = true);
            analyze(logical.right);
        } else if (node instanceof CallExpression call) {
            if (call.callee instanceof MemberExpression callee) {
                String method = callee.propertyName();
                if (method != null && ARRAY_METHODS.contains(method)) {
                    usage(callee.object).ifPresent(u -> {
                        u.usedAsArray = true;
                        u.hasArrayMethods = true;
                    });
                }
                for (Expression argument : call.arguments) {
                    analyze(argument);
                }
            }
        } else if (node instanceof BinaryExpression binary) {
            if (NUMERIC_OPERATORS.contains(binary.operator)) {
                usage(binary.left).ifPresent(PropTypeInference::markNumeric);
                usage(binary.right).ifPresent(PropTypeInference::markNumeric);
            }
            analyze(binary.left);
            analyze(binary.right);
        } else if (node instanceof MemberExpression member) {
            String property = member.propertyName();
            usage(member.object).ifPresent(u -> {
                if ("length".equals(property)) {
                    u.usedAsArray = true;
                    u.usedAsString = true;
                } else if (property != null) {
                    u.usedAsObject = true;
                }
            });
            analyze(member.object);
            if (member.computed) {
                analyze(member.property);
            }
        } else if (node instanceof JsxElement element) {
            for (JsxChild child : element.children) {
                analyze(child);
            }
            for (JsxAttributeItem item : element.attributes) {
                if (item instanceof JsxAttribute attr && attr.value instanceof JsxExpressionContainer container) {
                    analyze(container.expression);
                }
            }
        } else if (node instanceof JsxExpressionContainer container) {
            analyze(container.expression);
        } else if (node instanceof FunctionExpression function && function.arrow) {
            analyze(function.body);
        }
    }

    private static void markNumeric(Usage usage) {
        usage.usedAsNumber = true;
        usage.hasNumberOperations = true;
    }

    private Optional<Usage> usage(Expression expr) {
        String name = propName(expr);
        return Optional.ofNullable(name == null ? null : usages.get(name));
    }

    /**
     * The root identifier of a member chain.
     */
    static String propName(Expression expr) {
        if (expr instanceof Identifier id) {
            return id.name;
        }
        if (expr instanceof MemberExpression member) {
            return propName(member.object);
        }
        return null;
    }
}
