package org.dxworks.jsxframe.generator;

import org.dxworks.jsxframe.ast.ArrayExpression;
import org.dxworks.jsxframe.ast.AssignmentExpression;
import org.dxworks.jsxframe.ast.AstHelper;
import org.dxworks.jsxframe.ast.AwaitExpression;
import org.dxworks.jsxframe.ast.BinaryExpression;
import org.dxworks.jsxframe.ast.BlockStatement;
import org.dxworks.jsxframe.ast.BooleanLiteral;
import org.dxworks.jsxframe.ast.BreakStatement;
import org.dxworks.jsxframe.ast.CallExpression;
import org.dxworks.jsxframe.ast.CatchClause;
import org.dxworks.jsxframe.ast.ConditionalExpression;
import org.dxworks.jsxframe.ast.ContinueStatement;
import org.dxworks.jsxframe.ast.Expression;
import org.dxworks.jsxframe.ast.ExpressionStatement;
import org.dxworks.jsxframe.ast.ForOfStatement;
import org.dxworks.jsxframe.ast.ForStatement;
import org.dxworks.jsxframe.ast.FunctionExpression;
import org.dxworks.jsxframe.ast.Identifier;
import org.dxworks.jsxframe.ast.IfStatement;
import org.dxworks.jsxframe.ast.LogicalExpression;
import org.dxworks.jsxframe.ast.MemberExpression;
import org.dxworks.jsxframe.ast.NewExpression;
import org.dxworks.jsxframe.ast.Node;
import org.dxworks.jsxframe.ast.NullLiteral;
import org.dxworks.jsxframe.ast.NumericLiteral;
import org.dxworks.jsxframe.ast.ObjectExpression;
import org.dxworks.jsxframe.ast.ObjectMember;
import org.dxworks.jsxframe.ast.ObjectProperty;
import org.dxworks.jsxframe.ast.Pattern;
import org.dxworks.jsxframe.ast.ReturnStatement;
import org.dxworks.jsxframe.ast.SpreadElement;
import org.dxworks.jsxframe.ast.Statement;
import org.dxworks.jsxframe.ast.StringLiteral;
import org.dxworks.jsxframe.ast.TemplateLiteral;
import org.dxworks.jsxframe.ast.ThrowStatement;
import org.dxworks.jsxframe.ast.TryStatement;
import org.dxworks.jsxframe.ast.UnaryExpression;
import org.dxworks.jsxframe.ast.UpdateExpression;
import org.dxworks.jsxframe.ast.VariableDeclaration;
import org.dxworks.jsxframe.ast.WhileStatement;
import org.dxworks.jsxframe.ast.YieldExpression;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.dxworks.jsxframe.generator.CSharpStrings.indent;

/**
 * Translates the body of an async server task into C# statements: loops, branches, exception
 * handling, {@code await}/{@code yield}, and a table of LINQ, Math, JSON and console renames.
 * Unknown shapes become TODO marker comments in the output.
 */
public class ServerTaskTranspiler {

    private static final Map<String, String> ARRAY_METHODS = Map.ofEntries(
            Map.entry("map", "Select"),
            Map.entry("filter", "Where"),
            Map.entry("reduce", "Aggregate"),
            Map.entry("find", "FirstOrDefault"),
            Map.entry("findIndex", "FindIndex"),
            Map.entry("some", "Any"),
            Map.entry("every", "All"),
            Map.entry("includes", "Contains"),
            Map.entry("sort", "OrderBy"),
            Map.entry("reverse", "Reverse"),
            Map.entry("slice", "Skip"),
            Map.entry("concat", "Concat"),
            Map.entry("join", "Join"),
            Map.entry("split", "Split"));

    private static final Map<String, String> STATIC_METHODS = Map.ofEntries(
            Map.entry("console.log", "Console.WriteLine"),
            Map.entry("console.error", "Console.Error.WriteLine"),
            Map.entry("console.warn", "Console.WriteLine"),
            Map.entry("Math.floor", "Math.Floor"),
            Map.entry("Math.ceil", "Math.Ceiling"),
            Map.entry("Math.round", "Math.Round"),
            Map.entry("Math.abs", "Math.Abs"),
            Map.entry("Math.max", "Math.Max"),
            Map.entry("Math.min", "Math.Min"),
            Map.entry("Math.sqrt", "Math.Sqrt"),
            Map.entry("Math.pow", "Math.Pow"),
            Map.entry("JSON.stringify", "JsonSerializer.Serialize"),
            Map.entry("JSON.parse", "JsonSerializer.Deserialize"));

    public String transpileFunction(FunctionExpression function) {
        if (function.body instanceof BlockStatement block) {
            return transpileBlock(block);
        }
        return "return " + transpileExpression((Expression) function.body) + ";";
    }

    public String transpileBlock(BlockStatement block) {
        StringBuilder code = new StringBuilder();
        for (Statement statement : block.body) {
            code.append(transpileStatement(statement)).append('\n');
        }
        return code.toString();
    }

    public String transpileStatement(Node statement) {
        if (statement instanceof VariableDeclaration decl) {
            return decl.declarations.stream()
                    .map(d -> "var " + d.name() + " = " + (d.init != null ? transpileExpression(d.init) : "null") + ";")
                    .collect(Collectors.joining("\n"));
        }
        if (statement instanceof ReturnStatement ret) {
            return "return " + transpileExpression(ret.argument) + ";";
        }
        if (statement instanceof ExpressionStatement stmt) {
            if (stmt.expression instanceof YieldExpression yieldExpr) {
                return "yield return " + transpileExpression(yieldExpr.argument) + ";";
            }
            return transpileExpression(stmt.expression) + ";";
        }
        if (statement instanceof ForStatement forStmt) {
            String init = forInit(forStmt.init);
            String test = forStmt.test != null ? transpileExpression(forStmt.test) : "true";
            String update = forStmt.update != null ? transpileExpression(forStmt.update) : "";
            return "for (" + init + "; " + test + "; " + update + ")\n" + braced(transpileStatement(forStmt.body));
        }
        if (statement instanceof ForOfStatement forOf) {
            String left = forOfVariable(forOf.left);
            String right = transpileExpression(forOf.right);
            String loop = forOf.await ? "await foreach" : "foreach";
            return loop + " (var " + left + " in " + right + ")\n" + braced(transpileStatement(forOf.body));
        }
        if (statement instanceof WhileStatement whileStmt) {
            return "while (" + transpileExpression(whileStmt.test) + ")\n" + braced(transpileStatement(whileStmt.body));
        }
        if (statement instanceof IfStatement ifStmt) {
            String code = "if (" + transpileExpression(ifStmt.test) + ")\n" + braced(transpileStatement(ifStmt.consequent));
            if (ifStmt.alternate != null) {
                code += "\nelse\n" + braced(transpileStatement(ifStmt.alternate));
            }
            return code;
        }
        if (statement instanceof BlockStatement block) {
            return transpileBlock(block);
        }
        if (statement instanceof TryStatement tryStmt) {
            String code = "try\n" + braced(transpileBlock(tryStmt.block));
            if (tryStmt.handler != null) {
                code += catchClause(tryStmt.handler);
            }
            if (tryStmt.finalizer != null) {
                code += "\nfinally\n" + braced(transpileBlock(tryStmt.finalizer));
            }
            return code;
        }
        if (statement instanceof ThrowStatement throwStmt) {
            return "throw " + transpileExpression(throwStmt.argument) + ";";
        }
        if (statement instanceof BreakStatement) {
            return "break;";
        }
        if (statement instanceof ContinueStatement) {
            return "continue;";
        }
        return "/* TODO: Transpile " + (statement == null ? "null" : statement.getType()) + " */";
    }

    public String transpileExpression(Node expr) {
        if (expr == null) return "null";

        if (expr instanceof StringLiteral str) {
            return CSharpStrings.quote(str.value);
        }
        if (expr instanceof NumericLiteral num) {
            return AstHelper.formatNumber(num.value);
        }
        if (expr instanceof BooleanLiteral bool) {
            return bool.value ? "true" : "false";
        }
        if (expr instanceof NullLiteral) {
            return "null";
        }
        if (expr instanceof Identifier id) {
            if (id.name.equals("cancellationToken") || id.name.equals("cancel")) {
                return "cancellationToken";
            }
            return id.name;
        }
        if (expr instanceof MemberExpression member) {
            return member(member);
        }
        if (expr instanceof CallExpression call) {
            return call(call);
        }
        if (expr instanceof AwaitExpression awaitExpr) {
            return "await " + transpileExpression(awaitExpr.argument);
        }
        if (expr instanceof ArrayExpression array) {
            return "new[] { " + joined(array.elements) + " }";
        }
        if (expr instanceof ObjectExpression object) {
            return object(object);
        }
        if (expr instanceof FunctionExpression fn && fn.arrow) {
            String params = fn.params.stream().map(ServerTaskTranspiler::paramName).collect(Collectors.joining(", "));
            String body = fn.body instanceof BlockStatement block
                    ? braced(transpileBlock(block))
                    : transpileExpression(fn.body);
            return "(" + params + ") => " + body;
        }
        if (expr instanceof BinaryExpression bin) {
            return "(" + transpileExpression(bin.left) + " " + ExpressionGenerator.operator(bin.operator) + " "
                    + transpileExpression(bin.right) + ")";
        }
        if (expr instanceof LogicalExpression logical) {
            return "(" + transpileExpression(logical.left) + " " + logical.operator + " "
                    + transpileExpression(logical.right) + ")";
        }
        if (expr instanceof UnaryExpression unary) {
            return unary.operator + transpileExpression(unary.argument);
        }
        if (expr instanceof ConditionalExpression cond) {
            return "(" + transpileExpression(cond.test) + " ? " + transpileExpression(cond.consequent) + " : "
                    + transpileExpression(cond.alternate) + ")";
        }
        if (expr instanceof TemplateLiteral template) {
            return templateLiteral(template);
        }
        if (expr instanceof NewExpression newExpr) {
            return "new " + transpileExpression(newExpr.callee) + "(" + joined(newExpr.arguments) + ")";
        }
        if (expr instanceof AssignmentExpression assign) {
            return transpileExpression(assign.left) + " " + assign.operator + " " + transpileExpression(assign.right);
        }
        if (expr instanceof UpdateExpression update) {
            String argument = transpileExpression(update.argument);
            return update.prefix ? update.operator + argument : argument + update.operator;
        }
        return "/* TODO: " + expr.getType() + " */";
    }

    private String member(MemberExpression member) {
        String object = transpileExpression(member.object);
        String property = member.propertyName();
        if (member.computed || property == null) {
            return object + "[" + transpileExpression(member.property) + "]";
        }
        if (object.equals("progress") && property.equals("report")) {
            return "progress.Report";
        }
        if (object.equals("cancellationToken") && property.equals("requested")) {
            return "cancellationToken.IsCancellationRequested";
        }
        return object + "." + property;
    }

    private String call(CallExpression call) {
        String args = joined(call.arguments);

        if (call.callee instanceof MemberExpression member && member.propertyName() != null) {
            String method = member.propertyName();
            if (member.object instanceof Identifier owner) {
                String renamed = STATIC_METHODS.get(owner.name + "." + method);
                if (renamed != null) {
                    return renamed + "(" + args + ")";
                }
            }
            if (method.equals("toFixed")) {
                return transpileExpression(member.object) + ".ToString(\"F\" + " + args + ")";
            }
            String renamed = ARRAY_METHODS.get(method);
            if (renamed != null) {
                return transpileExpression(member.object) + "." + renamed + "(" + args + ")";
            }
        }
        if (AstHelper.isIdentifier(call.callee, "fetch")) {
            return "await _httpClient.GetStringAsync(" + args + ")";
        }
        return transpileExpression(call.callee) + "(" + args + ")";
    }

    private String object(ObjectExpression object) {
        List<String> props = new ArrayList<>();
        for (ObjectMember member : object.properties) {
            if (member instanceof ObjectProperty property) {
                String key = property.key instanceof Identifier id && !property.computed
                        ? id.name
                        : transpileExpression(property.key);
                props.add(AstHelper.capitalize(key) + " = " + transpileExpression(property.value));
            } else if (member instanceof SpreadElement spread) {
                props.add("/* spread: " + transpileExpression(spread.argument) + " */");
            }
        }
        return "new { " + String.join(", ", props) + " }";
    }

    private String templateLiteral(TemplateLiteral template) {
        StringBuilder result = new StringBuilder("$\"");
        for (int i = 0; i < template.cooked.size(); i++) {
            String cooked = template.cooked.get(i);
            result.append(cooked != null ? cooked : template.quasis.get(i));
            if (i < template.expressions.size()) {
                result.append('{').append(transpileExpression(template.expressions.get(i))).append('}');
            }
        }
        return result.append('"').toString();
    }

    private String catchClause(CatchClause handler) {
        String param = handler.param instanceof Identifier id ? id.name : "ex";
        return "\ncatch (Exception " + param + ")\n" + braced(transpileBlock(handler.body));
    }

    private String forInit(Node init) {
        if (init == null) {
            return "";
        }
        String code = init instanceof Expression expr ? transpileExpression(expr) : transpileStatement(init);
        return code.endsWith(";") ? code.substring(0, code.length() - 1) : code;
    }

    private static String forOfVariable(Node left) {
        if (left instanceof VariableDeclaration decl && !decl.declarations.isEmpty()) {
            return decl.declarations.get(0).name();
        }
        return left instanceof Identifier id ? id.name : "item";
    }

    private static String paramName(Pattern param) {
        return param instanceof Identifier id ? id.name : "_";
    }

    private String joined(List<Expression> expressions) {
        return expressions.stream().map(this::transpileExpression).collect(Collectors.joining(", "));
    }

    private static String braced(String body) {
        return "{\n" + indent(body, 4) + "\n}";
    }
}
