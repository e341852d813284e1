package org.dxworks.jsxframe.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

public class AstHelper {

    private AstHelper() {
    }

    /**
     * Formats a numeric literal the way JavaScript prints it: integral values without a fraction.
     */
    public static String formatNumber(double value) {
        if (Double.isFinite(value) && value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    /**
     * Literal value suitable for JSON output (Long for integral numbers), or null when the
     * expression is not a string, number or boolean literal.
     */
    public static Object literalValue(Expression expr) {
        if (expr instanceof StringLiteral str) {
            return str.value;
        }
        if (expr instanceof NumericLiteral num) {
            if (Double.isFinite(num.value) && num.value == Math.rint(num.value) && Math.abs(num.value) < 1e15) {
                return (long) num.value;
            }
            return num.value;
        }
        if (expr instanceof BooleanLiteral bool) {
            return bool.value;
        }
        return null;
    }

    /**
     * Text form of a string, number or boolean literal; null for anything else.
     */
    public static String literalText(Expression expr) {
        if (expr instanceof StringLiteral str) {
            return str.value;
        }
        if (expr instanceof NumericLiteral num) {
            return formatNumber(num.value);
        }
        if (expr instanceof BooleanLiteral bool) {
            return Boolean.toString(bool.value);
        }
        return null;
    }

    public static boolean isJsx(Node node) {
        return node instanceof JsxElement || node instanceof JsxFragment;
    }

    public static boolean isPluginElement(JsxElement element) {
        return element.name.equals("Plugin") || element.name.startsWith("Plugin.");
    }

    public static boolean isFunction(Node node) {
        return node instanceof FunctionExpression || node instanceof FunctionDeclaration;
    }

    public static boolean isIdentifier(Node node, String name) {
        return node instanceof Identifier id && id.name.equals(name);
    }

    public static String identifierName(Node node) {
        return node instanceof Identifier id ? id.name : null;
    }

    public static String calleeName(CallExpression call) {
        return identifierName(call.callee);
    }

    /**
     * Method name of {@code obj.method(...)} calls, null for plain function calls.
     */
    public static String methodName(CallExpression call) {
        if (call.callee instanceof MemberExpression member) {
            return member.propertyName();
        }
        return null;
    }

    public static boolean isMethodCall(Node node, String method) {
        return node instanceof CallExpression call && method.equals(methodName(call));
    }

    /**
     * Matches {@code object.property} where object is the given identifier.
     */
    public static boolean isMember(Node node, String object, String property) {
        return node instanceof MemberExpression member
                && isIdentifier(member.object, object)
                && property.equals(member.propertyName());
    }

    /**
     * Dotted path of a member chain, e.g. {@code user.address.city}. Computed links are skipped
     * and a non-identifier root is left out; returns null when nothing is left.
     */
    public static String memberPath(Expression expr) {
        List<String> parts = new ArrayList<>();
        Expression current = expr;
        while (current instanceof MemberExpression member) {
            String property = member.propertyName();
            if (property != null) {
                parts.add(property);
            }
            current = member.object;
        }
        if (current instanceof Identifier id) {
            parts.add(id.name);
        }
        if (parts.isEmpty()) {
            return null;
        }
        Collections.reverse(parts);
        return String.join(".", parts);
    }

    /**
     * Like {@link #memberPath(Expression)} but gives up (null) on computed links or a
     * non-identifier root.
     */
    public static String strictMemberPath(Expression expr) {
        List<String> parts = new ArrayList<>();
        Expression current = expr;
        while (current instanceof MemberExpression member) {
            String property = member.propertyName();
            if (property == null) {
                return null;
            }
            parts.add(property);
            current = member.object;
        }
        if (!(current instanceof Identifier id)) {
            return null;
        }
        parts.add(id.name);
        Collections.reverse(parts);
        return String.join(".", parts);
    }

    /**
     * Identifier name or member path of a binding expression, null for anything else.
     */
    public static String bindingPath(Expression expr) {
        if (expr instanceof Identifier id) {
            return id.name;
        }
        if (expr instanceof MemberExpression) {
            return memberPath(expr);
        }
        return null;
    }

    public static boolean isOptionalChain(Expression expr) {
        Expression current = expr;
        while (current instanceof MemberExpression member) {
            if (member.optional) {
                return true;
            }
            current = member.object;
        }
        return false;
    }

    public static Identifier rootIdentifier(Expression expr) {
        Expression current = expr;
        while (true) {
            if (current instanceof MemberExpression member) {
                current = member.object;
            } else if (current instanceof CallExpression call) {
                current = call.callee;
            } else {
                break;
            }
        }
        return current instanceof Identifier id ? id : null;
    }

    /**
     * Collects identifier names and member paths of simple operations, left to right.
     */
    public static void collectIdentifiers(Expression expr, List<String> result) {
        if (expr instanceof Identifier id) {
            result.add(id.name);
        } else if (expr instanceof BinaryExpression bin) {
            collectIdentifiers(bin.left, result);
            collectIdentifiers(bin.right, result);
        } else if (expr instanceof LogicalExpression logical) {
            collectIdentifiers(logical.left, result);
            collectIdentifiers(logical.right, result);
        } else if (expr instanceof UnaryExpression unary) {
            collectIdentifiers(unary.argument, result);
        } else if (expr instanceof MemberExpression) {
            String path = memberPath(expr);
            if (path != null) {
                result.add(path);
            }
        }
    }

    public static String capitalize(String s) {
        if (s == null || s.isEmpty()) return s == null ? "" : s;
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }

    /**
     * Visits the node and all of its descendants in source order.
     */
    public static void walk(Node node, Consumer<Node> visitor) {
        if (node == null) return;
        visitor.accept(node);
        for (Node child : children(node)) {
            walk(child, visitor);
        }
    }

    public static <T extends Node> List<T> findAll(Node root, Class<T> type) {
        List<T> result = new ArrayList<>();
        walk(root, n -> {
            if (type.isInstance(n)) {
                result.add(type.cast(n));
            }
        });
        return result;
    }

    /**
     * Direct children of a node in source order. Null slots (array holes, missing
     * initializers) are left out.
     */
    public static List<Node> children(Node node) {
        List<Node> out = new ArrayList<>();
        if (node instanceof Program program) {
            out.addAll(program.body);
        } else if (node instanceof TemplateLiteral template) {
            out.addAll(template.expressions);
        } else if (node instanceof ArrayExpression array) {
            out.addAll(array.elements);
        } else if (node instanceof ObjectExpression object) {
            out.addAll(object.properties);
        } else if (node instanceof ObjectProperty property) {
            if (property.computed) out.add(property.key);
            out.add(property.value);
        } else if (node instanceof SpreadElement spread) {
            out.add(spread.argument);
        } else if (node instanceof MemberExpression member) {
            out.add(member.object);
            out.add(member.property);
        } else if (node instanceof CallExpression call) {
            out.add(call.callee);
            out.addAll(call.arguments);
        } else if (node instanceof NewExpression newExpr) {
            out.add(newExpr.callee);
            out.addAll(newExpr.arguments);
        } else if (node instanceof UnaryExpression unary) {
            out.add(unary.argument);
        } else if (node instanceof UpdateExpression update) {
            out.add(update.argument);
        } else if (node instanceof BinaryExpression bin) {
            out.add(bin.left);
            out.add(bin.right);
        } else if (node instanceof LogicalExpression logical) {
            out.add(logical.left);
            out.add(logical.right);
        } else if (node instanceof ConditionalExpression cond) {
            out.add(cond.test);
            out.add(cond.consequent);
            out.add(cond.alternate);
        } else if (node instanceof AssignmentExpression assign) {
            out.add(assign.left);
            out.add(assign.right);
        } else if (node instanceof FunctionExpression fn) {
            out.addAll(fn.params);
            out.add(fn.body);
        } else if (node instanceof AwaitExpression awaitExpr) {
            out.add(awaitExpr.argument);
        } else if (node instanceof YieldExpression yieldExpr) {
            out.add(yieldExpr.argument);
        } else if (node instanceof JsxElement element) {
            out.addAll(element.attributes);
            out.addAll(element.children);
        } else if (node instanceof JsxFragment fragment) {
            out.addAll(fragment.children);
        } else if (node instanceof JsxExpressionContainer container) {
            out.add(container.expression);
        } else if (node instanceof JsxAttribute attr) {
            out.add(attr.value);
        } else if (node instanceof JsxSpreadAttribute spread) {
            out.add(spread.argument);
        } else if (node instanceof ArrayPattern pattern) {
            out.addAll(pattern.elements);
        } else if (node instanceof ObjectPattern pattern) {
            out.addAll(pattern.properties);
        } else if (node instanceof AssignmentPattern pattern) {
            out.add(pattern.left);
            out.add(pattern.right);
        } else if (node instanceof RestElement rest) {
            out.add(rest.argument);
        } else if (node instanceof BlockStatement block) {
            out.addAll(block.body);
        } else if (node instanceof ExpressionStatement stmt) {
            out.add(stmt.expression);
        } else if (node instanceof ReturnStatement ret) {
            out.add(ret.argument);
        } else if (node instanceof VariableDeclaration decl) {
            out.addAll(decl.declarations);
        } else if (node instanceof VariableDeclarator declarator) {
            out.add(declarator.id);
            out.add(declarator.init);
        } else if (node instanceof IfStatement ifStmt) {
            out.add(ifStmt.test);
            out.add(ifStmt.consequent);
            out.add(ifStmt.alternate);
        } else if (node instanceof ForStatement forStmt) {
            out.add(forStmt.init);
            out.add(forStmt.test);
            out.add(forStmt.update);
            out.add(forStmt.body);
        } else if (node instanceof ForOfStatement forOf) {
            out.add(forOf.left);
            out.add(forOf.right);
            out.add(forOf.body);
        } else if (node instanceof WhileStatement whileStmt) {
            out.add(whileStmt.test);
            out.add(whileStmt.body);
        } else if (node instanceof TryStatement tryStmt) {
            out.add(tryStmt.block);
            out.add(tryStmt.handler);
            out.add(tryStmt.finalizer);
        } else if (node instanceof CatchClause clause) {
            out.add(clause.param);
            out.add(clause.body);
        } else if (node instanceof ThrowStatement throwStmt) {
            out.add(throwStmt.argument);
        } else if (node instanceof FunctionDeclaration fn) {
            out.addAll(fn.params);
            out.add(fn.body);
        } else if (node instanceof ExportNamedDeclaration export) {
            out.add(export.declaration);
        } else if (node instanceof ExportDefaultDeclaration export) {
            out.add(export.declaration);
        }
        out.removeIf(n -> n == null);
        return out;
    }
}
