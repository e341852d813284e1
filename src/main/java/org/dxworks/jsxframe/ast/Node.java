package org.dxworks.jsxframe.ast;

/**
 * Root of the closed node hierarchy consumed by the compiler.
 * Nodes are immutable; every pass reads the same tree.
 */
public sealed interface Node
        permits Expression, Statement, Pattern, TypeNode, JsxChild, JsxAttributeItem, ObjectMember,
                Program, VariableDeclarator, CatchClause, ImportSpecifier, TsPropertySignature {

    /**
     * The Babel node type this node was read from, e.g. {@code "CallExpression"}.
     */
    String getType();
}
