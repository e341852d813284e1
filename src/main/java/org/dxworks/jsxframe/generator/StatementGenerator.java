package org.dxworks.jsxframe.generator;

import org.dxworks.jsxframe.ast.ExpressionStatement;
import org.dxworks.jsxframe.ast.Node;
import org.dxworks.jsxframe.ast.ReturnStatement;
import org.dxworks.jsxframe.ast.VariableDeclaration;

import java.util.stream.Collectors;

/**
 * Single-line statement translation used for effect and handler bodies.
 */
public class StatementGenerator {

    private final ExpressionGenerator expressions;

    public StatementGenerator(ExpressionGenerator expressions) {
        this.expressions = expressions;
    }

    public String generate(Node statement) {
        if (statement == null) return "";

        if (statement instanceof ExpressionStatement stmt) {
            return expressions.generate(stmt.expression) + ";";
        }
        if (statement instanceof ReturnStatement ret) {
            return "return " + expressions.generate(ret.argument) + ";";
        }
        if (statement instanceof VariableDeclaration decl) {
            return decl.declarations.stream()
                    .map(d -> "var " + d.name() + " = " + expressions.generate(d.init) + ";")
                    .collect(Collectors.joining(" "));
        }
        return expressions.generate(statement) + ";";
    }
}
