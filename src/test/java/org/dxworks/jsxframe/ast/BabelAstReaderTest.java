package org.dxworks.jsxframe.ast;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BabelAstReaderTest {

    private static final Path SAMPLES = Paths.get("src/test/resources/samples");

    private final BabelAstReader reader = new BabelAstReader();

    @Test
    void readsFileRootWithImportsExportsAndJsx() {
        Program program = reader.read(SAMPLES.resolve("Counter.ast.json"));

        assertEquals(2, program.body.size());
        ImportDeclaration imports = assertInstanceOf(ImportDeclaration.class, program.body.get(0));
        assertEquals("minimact", imports.source);
        assertEquals("useState", imports.specifiers.get(0).local);

        ExportNamedDeclaration export = assertInstanceOf(ExportNamedDeclaration.class, program.body.get(1));
        FunctionDeclaration counter = assertInstanceOf(FunctionDeclaration.class, export.declaration);
        assertEquals("Counter", counter.id);

        ReturnStatement ret = assertInstanceOf(ReturnStatement.class, counter.body.body.get(1));
        JsxElement div = assertInstanceOf(JsxElement.class, ret.argument);
        assertEquals("div", div.name);
        assertEquals("counter", ((StringLiteral) div.attribute("className").value).value);
        assertEquals(5, div.children.size());
        assertInstanceOf(JsxText.class, div.children.get(0));

        JsxElement button = (JsxElement) div.children.get(3);
        FunctionExpression onClick = assertInstanceOf(FunctionExpression.class, button.attribute("onClick").expression());
        assertTrue(onClick.arrow);
        assertInstanceOf(CallExpression.class, onClick.body);
    }

    @Test
    void readsTypeAnnotationsAndGenericArguments() {
        Program program = reader.read(SAMPLES.resolve("TodoList.ast.json"));

        ImportDeclaration imports = (ImportDeclaration) program.body.get(0);
        assertEquals(ImportSpecifier.Kind.DEFAULT, imports.specifiers.get(0).kind);

        VariableDeclarator declarator = ((VariableDeclaration) program.body.get(1)).declarations.get(0);
        FunctionExpression todoList = assertInstanceOf(FunctionExpression.class, declarator.init);
        ObjectPattern props = assertInstanceOf(ObjectPattern.class, todoList.params.get(0));
        TsTypeLiteral propTypes = assertInstanceOf(TsTypeLiteral.class, props.typeAnnotation);
        assertEquals("string", ((TsKeywordType) propTypes.members.get(0).typeAnnotation).keyword);

        BlockStatement body = (BlockStatement) todoList.body;
        CallExpression useState = (CallExpression) ((VariableDeclaration) body.body.get(0)).declarations.get(0).init;
        TsArrayType todos = assertInstanceOf(TsArrayType.class, useState.typeArguments.get(0));
        assertEquals("Todo", ((TsTypeReference) todos.elementType).name);
    }

    @Test
    void typeScriptWrappersAreUnwrappedAndUnknownNodesKept() {
        Program program = reader.read("{\"type\":\"Program\",\"body\":["
                + "{\"type\":\"ExpressionStatement\",\"expression\":{\"type\":\"TSAsExpression\","
                + "\"expression\":{\"type\":\"Identifier\",\"name\":\"value\"}}},"
                + "{\"type\":\"ClassDeclaration\"}]}");

        ExpressionStatement statement = (ExpressionStatement) program.body.get(0);
        assertEquals("value", ((Identifier) statement.expression).name);
        assertEquals("ClassDeclaration", ((UnsupportedNode) program.body.get(1)).type);
    }

    @Test
    void rejectsDocumentsThatAreNotPrograms() {
        assertThrows(AstReadException.class, () -> reader.read("{\"type\":\"Identifier\",\"name\":\"x\"}"));
        assertThrows(AstReadException.class, () -> reader.read("not json"));
        assertThrows(AstReadException.class, () -> reader.read(SAMPLES.resolve("Missing.ast.json")));
    }
}
