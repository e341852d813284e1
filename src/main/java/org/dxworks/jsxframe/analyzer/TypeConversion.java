package org.dxworks.jsxframe.analyzer;

import org.dxworks.jsxframe.ast.ArrayExpression;
import org.dxworks.jsxframe.ast.BinaryExpression;
import org.dxworks.jsxframe.ast.BooleanLiteral;
import org.dxworks.jsxframe.ast.CallExpression;
import org.dxworks.jsxframe.ast.Expression;
import org.dxworks.jsxframe.ast.LogicalExpression;
import org.dxworks.jsxframe.ast.MemberExpression;
import org.dxworks.jsxframe.ast.NullLiteral;
import org.dxworks.jsxframe.ast.NumericLiteral;
import org.dxworks.jsxframe.ast.ObjectExpression;
import org.dxworks.jsxframe.ast.StringLiteral;
import org.dxworks.jsxframe.ast.TemplateLiteral;
import org.dxworks.jsxframe.ast.TsArrayType;
import org.dxworks.jsxframe.ast.TsKeywordType;
import org.dxworks.jsxframe.ast.TsTypeLiteral;
import org.dxworks.jsxframe.ast.TsTypeReference;
import org.dxworks.jsxframe.ast.TypeNode;

import java.util.Map;
import java.util.Set;

/**
 * Mapping of TypeScript annotations and JavaScript initialisers to C# type names.
 */
public class TypeConversion {

    private static final Map<String, String> REFERENCE_TYPES = Map.ofEntries(
            Map.entry("decimal", "decimal"),
            Map.entry("int", "int"),
            Map.entry("int32", "int"),
            Map.entry("int64", "long"),
            Map.entry("long", "long"),
            Map.entry("float", "float"),
            Map.entry("float32", "float"),
            Map.entry("float64", "double"),
            Map.entry("double", "double"),
            Map.entry("short", "short"),
            Map.entry("int16", "short"),
            Map.entry("byte", "byte"),
            Map.entry("Guid", "Guid"),
            Map.entry("DateTime", "DateTime"),
            Map.entry("DateOnly", "DateOnly"),
            Map.entry("TimeOnly", "TimeOnly"));

    private static final Set<String> LIST_METHODS =
            Set.of("map", "filter", "sort", "sortBy", "orderBy", "slice", "concat");
    private static final Set<String> NUMBER_METHODS =
            Set.of("reduce", "sum", "sumBy", "mean", "meanBy", "average", "count", "size");
    private static final Set<String> ELEMENT_METHODS = Set.of("find", "minBy", "maxBy", "first", "last");
    private static final Set<String> STRING_METHODS = Set.of("format", "toString", "join");

    private static final Set<String> ARITHMETIC = Set.of("+", "-", "*", "/", "%");
    private static final Set<String> COMPARISON = Set.of("==", "===", "!=", "!==", "<", ">", "<=", ">=");

    private TypeConversion() {
    }

    /**
     * C# type of a state or prop annotation. Unknown references fall back to {@code dynamic}.
     */
    public static String tsTypeToCSharpType(TypeNode type) {
        if (type instanceof TsKeywordType keyword) {
            switch (keyword.keyword) {
                case "string":
                    return "string";
                case "number":
                    return "double";
                case "boolean":
                    return "bool";
                default:
                    return "dynamic";
            }
        }
        if (type instanceof TsArrayType array) {
            return "List<" + tsTypeToCSharpType(array.elementType) + ">";
        }
        if (type instanceof TsTypeLiteral) {
            return "dynamic";
        }
        if (type instanceof TsTypeReference reference) {
            return REFERENCE_TYPES.getOrDefault(reference.name, "dynamic");
        }
        return "dynamic";
    }

    /**
     * Type of a {@code useState} variable without an explicit generic argument.
     */
    public static String inferType(Expression init) {
        if (init instanceof StringLiteral) {
            return "string";
        }
        if (init instanceof NumericLiteral) {
            return "int";
        }
        if (init instanceof BooleanLiteral) {
            return "bool";
        }
        if (init instanceof NullLiteral) {
            return "dynamic";
        }
        if (init instanceof ArrayExpression) {
            return "List<dynamic>";
        }
        if (init instanceof ObjectExpression) {
            return "dynamic";
        }
        return "dynamic";
    }

    /**
     * Parameter and return types of server tasks. Unlike {@link #tsTypeToCSharpType(TypeNode)},
     * any type reference keeps its name.
     */
    public static String extractTypeAnnotation(TypeNode type) {
        if (type instanceof TsKeywordType keyword) {
            switch (keyword.keyword) {
                case "string":
                    return "string";
                case "number":
                    return "double";
                case "boolean":
                    return "bool";
                default:
                    return "object";
            }
        }
        if (type instanceof TsArrayType array) {
            return "List<" + extractTypeAnnotation(array.elementType) + ">";
        }
        if (type instanceof TsTypeReference reference) {
            return reference.name;
        }
        return "object";
    }

    /**
     * Type of a client-computed property, guessed from its initialiser.
     */
    public static String inferCSharpTypeFromInit(Expression init) {
        if (init instanceof ArrayExpression) {
            return "List<dynamic>";
        }
        if (init instanceof CallExpression call) {
            if (call.callee instanceof MemberExpression member) {
                String method = member.propertyName();
                if (method != null) {
                    if (LIST_METHODS.contains(method)) return "List<dynamic>";
                    if (NUMBER_METHODS.contains(method)) return "double";
                    if (ELEMENT_METHODS.contains(method)) return "dynamic";
                    if (STRING_METHODS.contains(method)) return "string";
                }
            }
            return "dynamic";
        }
        if (init instanceof TemplateLiteral || init instanceof StringLiteral) {
            return "string";
        }
        if (init instanceof NumericLiteral) {
            return "double";
        }
        if (init instanceof BooleanLiteral) {
            return "bool";
        }
        if (init instanceof BinaryExpression binary) {
            if (ARITHMETIC.contains(binary.operator)) return "double";
            if (COMPARISON.contains(binary.operator)) return "bool";
        }
        if (init instanceof LogicalExpression) {
            return "bool";
        }
        return "dynamic";
    }
}
