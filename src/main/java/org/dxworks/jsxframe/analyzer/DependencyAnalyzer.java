package org.dxworks.jsxframe.analyzer;

import org.dxworks.jsxframe.ast.AstHelper;
import org.dxworks.jsxframe.ast.BinaryExpression;
import org.dxworks.jsxframe.ast.CallExpression;
import org.dxworks.jsxframe.ast.ConditionalExpression;
import org.dxworks.jsxframe.ast.Expression;
import org.dxworks.jsxframe.ast.FunctionExpression;
import org.dxworks.jsxframe.ast.Identifier;
import org.dxworks.jsxframe.ast.LogicalExpression;
import org.dxworks.jsxframe.ast.MemberExpression;
import org.dxworks.jsxframe.ast.Node;
import org.dxworks.jsxframe.ast.TemplateLiteral;
import org.dxworks.jsxframe.ast.UnaryExpression;
import org.dxworks.jsxframe.model.Zone;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Finds the tracked state variables an expression reads. Property names of non-computed member
 * access ({@code user.count}) are not reads of {@code count}.
 */
public class DependencyAnalyzer {

    public record Dependency(String name, Zone zone) {
    }

    private DependencyAnalyzer() {
    }

    public static Set<Dependency> analyze(Expression expression, Map<String, Zone> stateTypes) {
        Set<Dependency> deps = new LinkedHashSet<>();
        walk(expression, stateTypes, deps);
        return deps;
    }

    private static void walk(Node node, Map<String, Zone> stateTypes, Set<Dependency> deps) {
        if (node == null) return;

        if (node instanceof Identifier id) {
            Zone zone = stateTypes.get(id.name);
            if (zone != null) {
                deps.add(new Dependency(id.name, zone));
            }
        } else if (node instanceof ConditionalExpression cond) {
            walk(cond.test, stateTypes, deps);
            walk(cond.consequent, stateTypes, deps);
            walk(cond.alternate, stateTypes, deps);
        } else if (node instanceof LogicalExpression logical) {
            walk(logical.left, stateTypes, deps);
            walk(logical.right, stateTypes, deps);
        } else if (node instanceof MemberExpression member) {
            walk(member.object, stateTypes, deps);
            if (member.computed) {
                walk(member.property, stateTypes, deps);
            }
        } else if (node instanceof CallExpression call) {
            walk(call.callee, stateTypes, deps);
            call.arguments.forEach(arg -> walk(arg, stateTypes, deps));
        } else if (node instanceof BinaryExpression bin) {
            walk(bin.left, stateTypes, deps);
            walk(bin.right, stateTypes, deps);
        } else if (node instanceof UnaryExpression unary) {
            walk(unary.argument, stateTypes, deps);
        } else if (node instanceof TemplateLiteral template) {
            template.expressions.forEach(expr -> walk(expr, stateTypes, deps));
        } else if (node instanceof FunctionExpression fn) {
            walk(fn.body, stateTypes, deps);
        } else if (!(node instanceof Expression)) {
            // statements of block-bodied callbacks
            AstHelper.children(node).forEach(child -> walk(child, stateTypes, deps));
        }
    }
}
