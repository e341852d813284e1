package org.dxworks.jsxframe.generator;

import org.dxworks.jsxframe.ast.AstHelper;
import org.dxworks.jsxframe.ast.CallExpression;
import org.dxworks.jsxframe.ast.ConditionalExpression;
import org.dxworks.jsxframe.ast.Expression;
import org.dxworks.jsxframe.ast.LogicalExpression;

/**
 * The statements of {@code Render()}: one return for JSX, a conditional return for ternaries,
 * an {@code if} for {@code &&}.
 */
public class RenderBodyGenerator {

    private final JsxGenerator jsx;
    private final ExpressionGenerator expressions;

    public RenderBodyGenerator(JsxGenerator jsx, ExpressionGenerator expressions) {
        this.jsx = jsx;
        this.expressions = expressions;
    }

    public String generate(Expression node, int indent) {
        String ind = CSharpStrings.indentLevel(indent);

        if (node == null) {
            return ind + "return new VText(\"\");";
        }
        if (AstHelper.isJsx(node)) {
            return ind + "return " + jsx.generateNode(node, indent) + ";";
        }
        if (node instanceof ConditionalExpression cond) {
            String condition = expressions.generate(cond.test);
            return ind + "return " + condition + "\n"
                    + ind + "    ? " + jsx.generateNode(cond.consequent, indent) + "\n"
                    + ind + "    : " + jsx.generateNode(cond.alternate, indent) + ";";
        }
        if (node instanceof LogicalExpression logical && logical.isAnd()) {
            String condition = expressions.generate(logical.left);
            return ind + "if (" + condition + ")\n"
                    + ind + "{\n"
                    + ind + "    return " + jsx.generateNode(logical.right, indent) + ";\n"
                    + ind + "}\n"
                    + ind + "return new VText(\"\");";
        }
        if (JsxGenerator.isMapCall(node)) {
            return ind + "return new Fragment(" + jsx.generateMapExpression((CallExpression) node, indent) + ");";
        }
        return ind + "return new VText(\"" + node.getType() + "\");";
    }
}
