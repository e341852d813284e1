package org.dxworks.jsxframe.ast;

/**
 * Binding targets: declarator ids, function parameters and assignment left-hand sides.
 */
public sealed interface Pattern extends Node
        permits Identifier, ArrayPattern, ObjectPattern, AssignmentPattern, RestElement, MemberExpression,
                UnsupportedNode {
}
