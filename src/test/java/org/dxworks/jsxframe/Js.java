package org.dxworks.jsxframe;

import org.dxworks.jsxframe.ast.ArrayExpression;
import org.dxworks.jsxframe.ast.ArrayPattern;
import org.dxworks.jsxframe.ast.BinaryExpression;
import org.dxworks.jsxframe.ast.BlockStatement;
import org.dxworks.jsxframe.ast.BooleanLiteral;
import org.dxworks.jsxframe.ast.CallExpression;
import org.dxworks.jsxframe.ast.ConditionalExpression;
import org.dxworks.jsxframe.ast.ExportNamedDeclaration;
import org.dxworks.jsxframe.ast.Expression;
import org.dxworks.jsxframe.ast.ExpressionStatement;
import org.dxworks.jsxframe.ast.FunctionDeclaration;
import org.dxworks.jsxframe.ast.FunctionExpression;
import org.dxworks.jsxframe.ast.Identifier;
import org.dxworks.jsxframe.ast.ImportDeclaration;
import org.dxworks.jsxframe.ast.ImportSpecifier;
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
import org.dxworks.jsxframe.ast.NumericLiteral;
import org.dxworks.jsxframe.ast.ObjectExpression;
import org.dxworks.jsxframe.ast.ObjectMember;
import org.dxworks.jsxframe.ast.ObjectPattern;
import org.dxworks.jsxframe.ast.ObjectProperty;
import org.dxworks.jsxframe.ast.Pattern;
import org.dxworks.jsxframe.ast.Program;
import org.dxworks.jsxframe.ast.ReturnStatement;
import org.dxworks.jsxframe.ast.Statement;
import org.dxworks.jsxframe.ast.StringLiteral;
import org.dxworks.jsxframe.ast.TemplateLiteral;
import org.dxworks.jsxframe.ast.TypeNode;
import org.dxworks.jsxframe.ast.UnaryExpression;
import org.dxworks.jsxframe.ast.VariableDeclaration;
import org.dxworks.jsxframe.ast.VariableDeclarator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Terse builders for input trees, named after the JavaScript they stand for.
 */
public final class Js {

    private Js() {
    }

    public static Identifier id(String name) {
        return new Identifier(name);
    }

    public static StringLiteral str(String value) {
        return new StringLiteral(value);
    }

    public static NumericLiteral num(double value) {
        return new NumericLiteral(value);
    }

    public static BooleanLiteral bool(boolean value) {
        return new BooleanLiteral(value);
    }

    public static NullLiteral nul() {
        return new NullLiteral();
    }

    /** {@code a.b.c} from "a", "b", "c". */
    public static Expression member(String root, String... properties) {
        Expression result = id(root);
        for (String property : properties) {
            result = new MemberExpression(result, id(property), false, false);
        }
        return result;
    }

    public static MemberExpression member(Expression object, String property) {
        return new MemberExpression(object, id(property), false, false);
    }

    /** {@code object?.property} */
    public static MemberExpression optional(Expression object, String property) {
        return new MemberExpression(object, id(property), false, true);
    }

    public static MemberExpression index(Expression object, Expression property) {
        return new MemberExpression(object, property, true, false);
    }

    public static CallExpression call(Expression callee, Expression... arguments) {
        return new CallExpression(callee, Arrays.asList(arguments));
    }

    public static CallExpression call(String callee, Expression... arguments) {
        return call(id(callee), arguments);
    }

    public static CallExpression typedCall(String callee, TypeNode typeArgument, Expression... arguments) {
        return new CallExpression(id(callee), Arrays.asList(arguments), false, List.of(typeArgument));
    }

    /** {@code object.method(arguments)} */
    public static CallExpression method(Expression object, String method, Expression... arguments) {
        return call(member(object, method), arguments);
    }

    public static BinaryExpression bin(String operator, Expression left, Expression right) {
        return new BinaryExpression(operator, left, right);
    }

    public static LogicalExpression and(Expression left, Expression right) {
        return new LogicalExpression("&&", left, right);
    }

    public static LogicalExpression or(Expression left, Expression right) {
        return new LogicalExpression("||", left, right);
    }

    public static UnaryExpression not(Expression argument) {
        return new UnaryExpression("!", argument);
    }

    public static UnaryExpression unary(String operator, Expression argument) {
        return new UnaryExpression(operator, argument);
    }

    public static ConditionalExpression cond(Expression test, Expression consequent, Expression alternate) {
        return new ConditionalExpression(test, consequent, alternate);
    }

    public static ArrayExpression array(Expression... elements) {
        return new ArrayExpression(Arrays.asList(elements));
    }

    /** Object literal from alternating key / value arguments. */
    public static ObjectExpression object(Object... keysAndValues) {
        List<ObjectMember> properties = new ArrayList<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            properties.add(new ObjectProperty(id((String) keysAndValues[i]), (Expression) keysAndValues[i + 1],
                    false, false));
        }
        return new ObjectExpression(properties);
    }

    /** Template literal from alternating quasi / expression arguments, starting and ending with a quasi. */
    public static TemplateLiteral template(Object... parts) {
        List<String> quasis = new ArrayList<>();
        List<Expression> expressions = new ArrayList<>();
        for (Object part : parts) {
            if (part instanceof String quasi) {
                quasis.add(quasi);
            } else {
                expressions.add((Expression) part);
            }
        }
        return new TemplateLiteral(quasis, null, expressions);
    }

    public static FunctionExpression arrow(List<Pattern> params, Expression body) {
        return new FunctionExpression(null, params, body, true, false, false, null);
    }

    public static FunctionExpression arrow(Expression body) {
        return arrow(List.of(), body);
    }

    public static FunctionExpression arrow(String param, Expression body) {
        return arrow(List.of(id(param)), body);
    }

    public static FunctionExpression arrowBlock(List<Pattern> params, Statement... statements) {
        return new FunctionExpression(null, params, block(statements), true, false, false, null);
    }

    public static BlockStatement block(Statement... statements) {
        return new BlockStatement(Arrays.asList(statements));
    }

    public static ReturnStatement ret(Expression argument) {
        return new ReturnStatement(argument);
    }

    public static ExpressionStatement stmt(Expression expression) {
        return new ExpressionStatement(expression);
    }

    public static VariableDeclaration constDecl(Pattern id, Expression init) {
        return new VariableDeclaration("const", List.of(new VariableDeclarator(id, init)));
    }

    public static VariableDeclaration constDecl(String name, Expression init) {
        return constDecl(id(name), init);
    }

    /** {@code [a, b]} destructuring. */
    public static ArrayPattern arrayPattern(String... names) {
        List<Pattern> elements = new ArrayList<>();
        for (String name : names) {
            elements.add(id(name));
        }
        return new ArrayPattern(elements);
    }

    /** {@code { a, b }} props destructuring. */
    public static ObjectPattern props(String... names) {
        List<ObjectMember> properties = new ArrayList<>();
        for (String name : names) {
            properties.add(new ObjectProperty(id(name), id(name), false, true));
        }
        return new ObjectPattern(properties, null);
    }

    public static JsxElement el(String tag, List<JsxAttributeItem> attributes, JsxChild... children) {
        return new JsxElement(tag, attributes, Arrays.asList(children), children.length == 0);
    }

    public static JsxElement el(String tag, JsxChild... children) {
        return el(tag, List.of(), children);
    }

    public static JsxFragment fragment(JsxChild... children) {
        return new JsxFragment(Arrays.asList(children));
    }

    public static JsxText text(String value) {
        return new JsxText(value);
    }

    public static JsxExpressionContainer expr(Expression expression) {
        return new JsxExpressionContainer(expression);
    }

    public static JsxAttribute attr(String name, String value) {
        return new JsxAttribute(name, str(value));
    }

    public static JsxAttribute attr(String name, Expression value) {
        return new JsxAttribute(name, expr(value));
    }

    public static List<JsxAttributeItem> attrs(JsxAttributeItem... attributes) {
        return Arrays.asList(attributes);
    }

    public static FunctionDeclaration component(String name, List<Pattern> params, Statement... body) {
        return new FunctionDeclaration(name, params, block(body), false, false, null);
    }

    public static FunctionDeclaration component(String name, Statement... body) {
        return component(name, List.of(), body);
    }

    public static FunctionExpression componentFunction(Statement... body) {
        return new FunctionExpression(null, List.of(), block(body), true, false, false, null);
    }

    public static ExportNamedDeclaration export(Statement declaration) {
        return new ExportNamedDeclaration(declaration);
    }

    public static ImportDeclaration importFrom(String source, String... names) {
        List<ImportSpecifier> specifiers = new ArrayList<>();
        for (String name : names) {
            specifiers.add(new ImportSpecifier(ImportSpecifier.Kind.NAMED, name));
        }
        return new ImportDeclaration(source, specifiers);
    }

    public static Program program(Statement... body) {
        return new Program(Arrays.asList(body));
    }
}
