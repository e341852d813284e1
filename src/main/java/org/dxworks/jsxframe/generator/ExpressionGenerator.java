package org.dxworks.jsxframe.generator;

import org.dxworks.jsxframe.ast.ArrayExpression;
import org.dxworks.jsxframe.ast.AstHelper;
import org.dxworks.jsxframe.ast.BinaryExpression;
import org.dxworks.jsxframe.ast.BooleanLiteral;
import org.dxworks.jsxframe.ast.CallExpression;
import org.dxworks.jsxframe.ast.ConditionalExpression;
import org.dxworks.jsxframe.ast.Expression;
import org.dxworks.jsxframe.ast.Identifier;
import org.dxworks.jsxframe.ast.LogicalExpression;
import org.dxworks.jsxframe.ast.MemberExpression;
import org.dxworks.jsxframe.ast.Node;
import org.dxworks.jsxframe.ast.NullLiteral;
import org.dxworks.jsxframe.ast.NumericLiteral;
import org.dxworks.jsxframe.ast.ObjectExpression;
import org.dxworks.jsxframe.ast.ObjectMember;
import org.dxworks.jsxframe.ast.ObjectProperty;
import org.dxworks.jsxframe.ast.StringLiteral;
import org.dxworks.jsxframe.ast.TemplateLiteral;
import org.dxworks.jsxframe.ast.UnaryExpression;
import org.dxworks.jsxframe.compiler.CompilerContext;
import org.dxworks.jsxframe.model.StateInfo;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Translates JavaScript expressions into C# expression text. Shapes outside the supported set
 * come out as {@code null}.
 */
public class ExpressionGenerator {

    private static final Pattern CSHARP_IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

    private final CompilerContext context;

    /**
     * @param context component being compiled, used to recognise state setters; may be null
     */
    public ExpressionGenerator(CompilerContext context) {
        this.context = context;
    }

    public String generate(Node node) {
        return generate(node, false);
    }

    /**
     * @param inInterpolation true when the result is placed inside {@code $"{...}"}, where string
     *                        literals need escaped quotes
     */
    public String generate(Node node, boolean inInterpolation) {
        if (node == null) return "null";

        if (node instanceof StringLiteral str) {
            return inInterpolation
                    ? "\\\"" + CSharpStrings.escape(str.value) + "\\\""
                    : CSharpStrings.quote(str.value);
        }
        if (node instanceof NumericLiteral num) {
            return AstHelper.formatNumber(num.value);
        }
        if (node instanceof BooleanLiteral bool) {
            return bool.value ? "true" : "false";
        }
        if (node instanceof NullLiteral) {
            return "null";
        }
        if (node instanceof Identifier id) {
            return id.name;
        }
        if (node instanceof MemberExpression member) {
            return member.optional ? optionalMember(member, inInterpolation) : member(member);
        }
        if (node instanceof ArrayExpression array) {
            String elements = array.elements.stream().map(this::generate).collect(Collectors.joining(", "));
            return "new List<object> { " + elements + " }";
        }
        if (node instanceof UnaryExpression unary) {
            return unary.operator + generate(unary.argument, inInterpolation);
        }
        if (node instanceof BinaryExpression bin) {
            return generate(bin.left) + " " + operator(bin.operator) + " " + generate(bin.right);
        }
        if (node instanceof LogicalExpression logical) {
            return generate(logical.left) + " " + logical.operator + " " + generate(logical.right);
        }
        if (node instanceof ConditionalExpression cond) {
            return "(" + generate(cond.test) + ") ? " + generate(cond.consequent) + " : " + generate(cond.alternate);
        }
        if (node instanceof CallExpression call) {
            return call(call);
        }
        if (node instanceof TemplateLiteral template) {
            return templateLiteral(template);
        }
        if (node instanceof ObjectExpression object) {
            return object(object);
        }
        return "null";
    }

    /**
     * Generates a condition operand. Identifiers and simple member reads are wrapped in
     * {@code MObject} so they follow JavaScript truthiness.
     */
    public String generateBoolean(Expression expr) {
        String generated = generate(expr);
        if (expr instanceof MemberExpression member && !member.computed && member.object instanceof Identifier) {
            return "new MObject(" + generated + ")";
        }
        if (expr instanceof Identifier) {
            return "new MObject(" + generated + ")";
        }
        return generated;
    }

    private String optionalMember(MemberExpression member, boolean inInterpolation) {
        String object = generate(member.object, inInterpolation);
        if (member.computed) {
            return object + "?[" + generate(member.property, inInterpolation) + "]";
        }
        return object + "?." + AstHelper.capitalize(member.propertyName());
    }

    private String member(MemberExpression member) {
        String object = generate(member.object);
        if (member.computed) {
            return object + "[" + generate(member.property) + "]";
        }
        String property = member.propertyName();
        if (property == null) {
            return object + ".null";
        }
        switch (property) {
            case "length":
                return object + ".Count";
            case "target":
                return object + ".Target";
            case "value":
                return object + ".Value";
            case "checked":
                return object + ".Checked";
            default:
                return object + "." + property;
        }
    }

    private String call(CallExpression call) {
        if (AstHelper.isMember(call.callee, "Math", "max")) {
            return "Math.Max(" + arguments(call, ", ") + ")";
        }
        if (AstHelper.isMember(call.callee, "Math", "min")) {
            return "Math.Min(" + arguments(call, ", ") + ")";
        }
        if (AstHelper.isIdentifier(call.callee, "alert") || AstHelper.isMember(call.callee, "console", "log")) {
            return "Console.WriteLine(" + arguments(call, " + ") + ")";
        }
        if (call.callee instanceof MemberExpression member && "toFixed".equals(member.propertyName())) {
            String decimals = !call.arguments.isEmpty() && call.arguments.get(0) instanceof NumericLiteral num
                    ? AstHelper.formatNumber(num.value)
                    : "2";
            return generate(member.object) + ".ToString(\"F" + decimals + "\")";
        }
        if (call.callee instanceof Identifier callee && context != null && !call.arguments.isEmpty()) {
            StateInfo state = context.stateForSetter(callee.name);
            if (state != null) {
                return "SetState(nameof(" + state.name + "), " + generate(call.arguments.get(0)) + ")";
            }
        }
        return generate(call.callee) + "(" + arguments(call, ", ") + ")";
    }

    private String arguments(CallExpression call, String separator) {
        return call.arguments.stream().map(this::generate).collect(Collectors.joining(separator));
    }

    private String templateLiteral(TemplateLiteral template) {
        StringBuilder result = new StringBuilder("$\"");
        for (int i = 0; i < template.quasis.size(); i++) {
            result.append(template.quasis.get(i));
            if (i < template.expressions.size()) {
                result.append('{').append(generate(template.expressions.get(i))).append('}');
            }
        }
        return result.append('"').toString();
    }

    private String object(ObjectExpression object) {
        boolean dictionary = false;
        for (ObjectMember member : object.properties) {
            if (member instanceof ObjectProperty property) {
                String key = property.keyName();
                if (key != null && !CSHARP_IDENTIFIER.matcher(key).matches()) {
                    dictionary = true;
                }
            }
        }

        List<String> entries = new ArrayList<>();
        for (ObjectMember member : object.properties) {
            if (member instanceof ObjectProperty property) {
                String key = property.keyName();
                if (key == null) {
                    key = generate(property.key);
                }
                String value = generate(property.value);
                entries.add(dictionary ? "[\"" + key + "\"] = " + value : key + " = " + value);
            }
        }
        if (entries.isEmpty()) {
            return "null";
        }
        return dictionary
                ? "new Dictionary<string, object> { " + String.join(", ", entries) + " }"
                : "new { " + String.join(", ", entries) + " }";
    }

    static String operator(String operator) {
        switch (operator) {
            case "===":
                return "==";
            case "!==":
                return "!=";
            default:
                return operator;
        }
    }
}
