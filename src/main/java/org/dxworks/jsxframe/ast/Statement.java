package org.dxworks.jsxframe.ast;

public sealed interface Statement extends Node
        permits BlockStatement, ExpressionStatement, ReturnStatement, VariableDeclaration, IfStatement,
                ForStatement, ForOfStatement, WhileStatement, TryStatement, ThrowStatement,
                BreakStatement, ContinueStatement, FunctionDeclaration, ImportDeclaration,
                ExportNamedDeclaration, ExportDefaultDeclaration, UnsupportedNode {
}
