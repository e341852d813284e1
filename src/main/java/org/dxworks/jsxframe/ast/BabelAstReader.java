package org.dxworks.jsxframe.ast;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Reads the JSON serialization of a Babel AST ({@code File} or {@code Program} root, parsed
 * with the {@code jsx} and {@code typescript} plugins) into the immutable node model.
 * Node kinds outside the model become {@link UnsupportedNode}s; TypeScript-only expression
 * wrappers are unwrapped.
 */
public class BabelAstReader {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public Program read(Path file) {
        try {
            return readProgram(MAPPER.readTree(file.toFile()));
        } catch (IOException e) {
            throw new AstReadException("Failed to read AST from " + file + ": " + e.getMessage(), e);
        }
    }

    public Program read(String json) {
        try {
            return readProgram(MAPPER.readTree(json));
        } catch (IOException e) {
            throw new AstReadException("Failed to parse AST JSON: " + e.getMessage(), e);
        }
    }

    public Program readProgram(JsonNode root) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new AstReadException("Empty AST document");
        }
        String type = type(root);
        if ("File".equals(type)) {
            return readProgram(root.get("program"));
        }
        if (!"Program".equals(type)) {
            throw new AstReadException("Expected a File or Program root but found " + type);
        }
        return new Program(list(root.get("body"), this::statement));
    }

    // --- statements ---

    public Statement statement(JsonNode n) {
        if (isNull(n)) return null;
        String type = type(n);
        switch (type) {
            case "BlockStatement":
                return block(n);
            case "ExpressionStatement":
                return new ExpressionStatement(expression(n.get("expression")));
            case "ReturnStatement":
                return new ReturnStatement(expression(n.get("argument")));
            case "VariableDeclaration":
                return variableDeclaration(n);
            case "IfStatement":
                return new IfStatement(expression(n.get("test")), statement(n.get("consequent")),
                        statement(n.get("alternate")));
            case "ForStatement":
                return new ForStatement(forInit(n.get("init")), expression(n.get("test")),
                        expression(n.get("update")), statement(n.get("body")));
            case "ForOfStatement":
                return new ForOfStatement(forInit(n.get("left")), expression(n.get("right")),
                        statement(n.get("body")), bool(n, "await"));
            case "WhileStatement":
                return new WhileStatement(expression(n.get("test")), statement(n.get("body")));
            case "TryStatement":
                return new TryStatement(block(n.get("block")), catchClause(n.get("handler")),
                        isNull(n.get("finalizer")) ? null : block(n.get("finalizer")));
            case "ThrowStatement":
                return new ThrowStatement(expression(n.get("argument")));
            case "BreakStatement":
                return new BreakStatement();
            case "ContinueStatement":
                return new ContinueStatement();
            case "FunctionDeclaration":
                return new FunctionDeclaration(idName(n.get("id")), list(n.get("params"), this::pattern),
                        block(n.get("body")), bool(n, "async"), bool(n, "generator"),
                        typeAnnotation(n.get("returnType")));
            case "ImportDeclaration":
                return importDeclaration(n);
            case "ExportNamedDeclaration":
                return new ExportNamedDeclaration(statement(n.get("declaration")));
            case "ExportDefaultDeclaration":
                return new ExportDefaultDeclaration(exportDefault(n.get("declaration")));
            default:
                return new UnsupportedNode(type);
        }
    }

    private BlockStatement block(JsonNode n) {
        if (isNull(n)) return new BlockStatement(List.of());
        return new BlockStatement(list(n.get("body"), this::statement));
    }

    private VariableDeclaration variableDeclaration(JsonNode n) {
        List<VariableDeclarator> declarators = new ArrayList<>();
        for (JsonNode d : iterable(n.get("declarations"))) {
            declarators.add(new VariableDeclarator(pattern(d.get("id")), expression(d.get("init"))));
        }
        return new VariableDeclaration(text(n, "kind"), declarators);
    }

    private Node forInit(JsonNode n) {
        if (isNull(n)) return null;
        if ("VariableDeclaration".equals(type(n))) {
            return variableDeclaration(n);
        }
        String type = type(n);
        if (type.endsWith("Pattern")) {
            return pattern(n);
        }
        return expression(n);
    }

    private CatchClause catchClause(JsonNode n) {
        if (isNull(n)) return null;
        return new CatchClause(pattern(n.get("param")), block(n.get("body")));
    }

    private ImportDeclaration importDeclaration(JsonNode n) {
        List<ImportSpecifier> specifiers = new ArrayList<>();
        for (JsonNode s : iterable(n.get("specifiers"))) {
            String local = idName(s.get("local"));
            switch (type(s)) {
                case "ImportDefaultSpecifier":
                    specifiers.add(new ImportSpecifier(ImportSpecifier.Kind.DEFAULT, local));
                    break;
                case "ImportNamespaceSpecifier":
                    specifiers.add(new ImportSpecifier(ImportSpecifier.Kind.NAMESPACE, local));
                    break;
                default:
                    specifiers.add(new ImportSpecifier(ImportSpecifier.Kind.NAMED, local));
            }
        }
        JsonNode source = n.get("source");
        return new ImportDeclaration(isNull(source) ? "" : text(source, "value"), specifiers);
    }

    private Node exportDefault(JsonNode n) {
        if (isNull(n)) return null;
        if ("FunctionDeclaration".equals(type(n))) {
            return statement(n);
        }
        return expression(n);
    }

    // --- expressions ---

    public Expression expression(JsonNode n) {
        if (isNull(n)) return null;
        String type = type(n);
        switch (type) {
            case "Identifier":
                return identifier(n);
            case "StringLiteral":
                return new StringLiteral(text(n, "value"));
            case "NumericLiteral":
                return new NumericLiteral(n.path("value").asDouble());
            case "BooleanLiteral":
                return new BooleanLiteral(n.path("value").asBoolean());
            case "NullLiteral":
                return new NullLiteral();
            case "RegExpLiteral":
                return new RegExpLiteral(text(n, "pattern"), text(n, "flags"));
            case "Literal":
                return estreeLiteral(n);
            case "TemplateLiteral":
                return templateLiteral(n);
            case "ArrayExpression":
                return new ArrayExpression(list(n.get("elements"), this::expression));
            case "ObjectExpression":
                return new ObjectExpression(list(n.get("properties"), this::objectMember));
            case "MemberExpression":
                return new MemberExpression(expression(n.get("object")), expression(n.get("property")),
                        bool(n, "computed"), false);
            case "OptionalMemberExpression":
                return new MemberExpression(expression(n.get("object")), expression(n.get("property")),
                        bool(n, "computed"), bool(n, "optional"));
            case "CallExpression":
                return new CallExpression(expression(n.get("callee")), list(n.get("arguments"), this::expression),
                        false, typeArguments(n));
            case "OptionalCallExpression":
                return new CallExpression(expression(n.get("callee")), list(n.get("arguments"), this::expression),
                        bool(n, "optional"), typeArguments(n));
            case "NewExpression":
                return new NewExpression(expression(n.get("callee")), list(n.get("arguments"), this::expression));
            case "UnaryExpression":
                return new UnaryExpression(text(n, "operator"), expression(n.get("argument")));
            case "UpdateExpression":
                return new UpdateExpression(text(n, "operator"), expression(n.get("argument")), bool(n, "prefix"));
            case "BinaryExpression":
                return new BinaryExpression(text(n, "operator"), expression(n.get("left")), expression(n.get("right")));
            case "LogicalExpression":
                return new LogicalExpression(text(n, "operator"), expression(n.get("left")), expression(n.get("right")));
            case "ConditionalExpression":
                return new ConditionalExpression(expression(n.get("test")), expression(n.get("consequent")),
                        expression(n.get("alternate")));
            case "AssignmentExpression":
                return new AssignmentExpression(text(n, "operator"), pattern(n.get("left")), expression(n.get("right")));
            case "ArrowFunctionExpression":
            case "FunctionExpression":
                return function(n);
            case "AwaitExpression":
                return new AwaitExpression(expression(n.get("argument")));
            case "YieldExpression":
                return new YieldExpression(expression(n.get("argument")), bool(n, "delegate"));
            case "SpreadElement":
                return new SpreadElement(expression(n.get("argument")));
            case "ThisExpression":
                return new ThisExpression();
            case "JSXElement":
                return jsxElement(n);
            case "JSXFragment":
                return new JsxFragment(list(n.get("children"), this::jsxChild));
            case "JSXEmptyExpression":
                return new JsxEmptyExpression();
            case "TSAsExpression":
            case "TSSatisfiesExpression":
            case "TSNonNullExpression":
            case "TSTypeAssertion":
            case "ParenthesizedExpression":
                return expression(n.get("expression"));
            default:
                return new UnsupportedNode(type);
        }
    }

    private Identifier identifier(JsonNode n) {
        return new Identifier(text(n, "name"), typeAnnotation(n.get("typeAnnotation")));
    }

    private Expression estreeLiteral(JsonNode n) {
        JsonNode value = n.get("value");
        if (n.has("regex")) {
            return new RegExpLiteral(text(n.get("regex"), "pattern"), text(n.get("regex"), "flags"));
        }
        if (isNull(value)) return new NullLiteral();
        if (value.isTextual()) return new StringLiteral(value.asText());
        if (value.isNumber()) return new NumericLiteral(value.asDouble());
        if (value.isBoolean()) return new BooleanLiteral(value.asBoolean());
        return new UnsupportedNode("Literal");
    }

    private TemplateLiteral templateLiteral(JsonNode n) {
        List<String> raw = new ArrayList<>();
        List<String> cooked = new ArrayList<>();
        for (JsonNode quasi : iterable(n.get("quasis"))) {
            JsonNode value = quasi.path("value");
            String rawText = value.path("raw").asText("");
            raw.add(rawText);
            cooked.add(value.hasNonNull("cooked") ? value.get("cooked").asText() : rawText);
        }
        return new TemplateLiteral(raw, cooked, list(n.get("expressions"), this::expression));
    }

    private FunctionExpression function(JsonNode n) {
        JsonNode body = n.get("body");
        Node bodyNode = "BlockStatement".equals(type(body)) ? block(body) : expression(body);
        return new FunctionExpression(idName(n.get("id")), list(n.get("params"), this::pattern), bodyNode,
                "ArrowFunctionExpression".equals(type(n)), bool(n, "async"), bool(n, "generator"),
                typeAnnotation(n.get("returnType")));
    }

    private ObjectMember objectMember(JsonNode n) {
        String type = type(n);
        switch (type) {
            case "SpreadElement":
                return new SpreadElement(expression(n.get("argument")));
            case "RestElement":
                return new RestElement(pattern(n.get("argument")));
            case "ObjectMethod": {
                Expression fn = new FunctionExpression(null, list(n.get("params"), this::pattern),
                        block(n.get("body")), false, bool(n, "async"), bool(n, "generator"),
                        typeAnnotation(n.get("returnType")));
                return new ObjectProperty(expression(n.get("key")), fn, bool(n, "computed"), false);
            }
            default:
                return new ObjectProperty(expression(n.get("key")), expression(n.get("value")),
                        bool(n, "computed"), bool(n, "shorthand"));
        }
    }

    // --- JSX ---

    private JsxElement jsxElement(JsonNode n) {
        JsonNode opening = n.path("openingElement");
        List<JsxAttributeItem> attributes = new ArrayList<>();
        for (JsonNode attr : iterable(opening.get("attributes"))) {
            if ("JSXSpreadAttribute".equals(type(attr))) {
                attributes.add(new JsxSpreadAttribute(expression(attr.get("argument"))));
            } else {
                attributes.add(new JsxAttribute(jsxName(attr.get("name")), jsxAttributeValue(attr.get("value"))));
            }
        }
        return new JsxElement(jsxName(opening.get("name")), attributes,
                list(n.get("children"), this::jsxChild), bool(opening, "selfClosing"));
    }

    private Node jsxAttributeValue(JsonNode n) {
        if (isNull(n)) return null;
        String type = type(n);
        if ("JSXExpressionContainer".equals(type)) {
            return new JsxExpressionContainer(expression(n.get("expression")));
        }
        if ("StringLiteral".equals(type) || "Literal".equals(type)) {
            return new StringLiteral(text(n, "value"));
        }
        return expression(n);
    }

    private JsxChild jsxChild(JsonNode n) {
        String type = type(n);
        switch (type) {
            case "JSXText":
                return new JsxText(text(n, "value"));
            case "JSXElement":
                return jsxElement(n);
            case "JSXFragment":
                return new JsxFragment(list(n.get("children"), this::jsxChild));
            case "JSXExpressionContainer":
                return new JsxExpressionContainer(expression(n.get("expression")));
            default:
                return new JsxExpressionContainer(new UnsupportedNode(type));
        }
    }

    private String jsxName(JsonNode n) {
        if (isNull(n)) return "";
        switch (type(n)) {
            case "JSXMemberExpression":
                return jsxName(n.get("object")) + "." + jsxName(n.get("property"));
            case "JSXNamespacedName":
                return jsxName(n.get("namespace")) + ":" + jsxName(n.get("name"));
            default:
                return text(n, "name");
        }
    }

    // --- patterns ---

    public Pattern pattern(JsonNode n) {
        if (isNull(n)) return null;
        String type = type(n);
        switch (type) {
            case "Identifier":
                return identifier(n);
            case "ArrayPattern":
                return new ArrayPattern(list(n.get("elements"), this::pattern));
            case "ObjectPattern": {
                List<ObjectMember> properties = new ArrayList<>();
                for (JsonNode p : iterable(n.get("properties"))) {
                    if ("RestElement".equals(type(p))) {
                        properties.add(new RestElement(pattern(p.get("argument"))));
                    } else {
                        properties.add(new ObjectProperty(expression(p.get("key")), pattern(p.get("value")),
                                bool(p, "computed"), bool(p, "shorthand")));
                    }
                }
                return new ObjectPattern(properties, typeAnnotation(n.get("typeAnnotation")));
            }
            case "AssignmentPattern":
                return new AssignmentPattern(pattern(n.get("left")), expression(n.get("right")));
            case "RestElement":
                return new RestElement(pattern(n.get("argument")));
            case "MemberExpression":
            case "OptionalMemberExpression":
                return (MemberExpression) expression(n);
            case "TSParameterProperty":
                return pattern(n.get("parameter"));
            default:
                return new UnsupportedNode(type);
        }
    }

    // --- TypeScript types ---

    private TypeNode typeAnnotation(JsonNode n) {
        if (isNull(n)) return null;
        if ("TSTypeAnnotation".equals(type(n))) {
            return typeNode(n.get("typeAnnotation"));
        }
        return typeNode(n);
    }

    private TypeNode typeNode(JsonNode n) {
        if (isNull(n)) return null;
        String type = type(n);
        if (type.startsWith("TS") && type.endsWith("Keyword")) {
            String keyword = type.substring(2, type.length() - "Keyword".length());
            return new TsKeywordType(keyword.toLowerCase());
        }
        switch (type) {
            case "TSArrayType":
                return new TsArrayType(typeNode(n.get("elementType")));
            case "TSTypeReference":
                return new TsTypeReference(entityName(n.get("typeName")), typeArguments(n));
            case "TSTypeLiteral": {
                List<TsPropertySignature> members = new ArrayList<>();
                for (JsonNode m : iterable(n.get("members"))) {
                    if ("TSPropertySignature".equals(type(m))) {
                        String name = propertyKey(m.get("key"));
                        if (name != null) {
                            members.add(new TsPropertySignature(name, typeAnnotation(m.get("typeAnnotation")),
                                    bool(m, "optional")));
                        }
                    }
                }
                return new TsTypeLiteral(members);
            }
            case "TSParenthesizedType":
                return typeNode(n.get("typeAnnotation"));
            default:
                return new TsUnknownType(type);
        }
    }

    private List<TypeNode> typeArguments(JsonNode n) {
        JsonNode params = n.hasNonNull("typeParameters") ? n.get("typeParameters") : n.get("typeArguments");
        return isNull(params) ? List.of() : list(params.get("params"), this::typeNode);
    }

    private String entityName(JsonNode n) {
        if (isNull(n)) return "";
        if ("TSQualifiedName".equals(type(n))) {
            return entityName(n.get("left")) + "." + entityName(n.get("right"));
        }
        return text(n, "name");
    }

    private String propertyKey(JsonNode key) {
        if (isNull(key)) return null;
        String type = type(key);
        if ("Identifier".equals(type)) return text(key, "name");
        if ("StringLiteral".equals(type)) return text(key, "value");
        return null;
    }

    // --- JSON plumbing ---

    private static String type(JsonNode n) {
        return n == null ? "" : n.path("type").asText("");
    }

    private static boolean isNull(JsonNode n) {
        return n == null || n.isNull() || n.isMissingNode();
    }

    private static String text(JsonNode n, String field) {
        JsonNode value = n.get(field);
        return isNull(value) ? null : value.asText();
    }

    private static boolean bool(JsonNode n, String field) {
        return n.path(field).asBoolean(false);
    }

    private static String idName(JsonNode n) {
        return isNull(n) ? null : text(n, "name");
    }

    private static Iterable<JsonNode> iterable(JsonNode array) {
        if (isNull(array) || !array.isArray()) {
            return List.of();
        }
        return array;
    }

    private static <T> List<T> list(JsonNode array, Function<JsonNode, T> mapper) {
        List<T> result = new ArrayList<>();
        for (JsonNode item : iterable(array)) {
            result.add(isNull(item) ? null : mapper.apply(item));
        }
        return result;
    }
}
