package org.dxworks.jsxframe.ast;

public sealed interface Expression extends Node
        permits Identifier, StringLiteral, NumericLiteral, BooleanLiteral, NullLiteral, RegExpLiteral,
                TemplateLiteral, ArrayExpression, ObjectExpression, MemberExpression, CallExpression,
                NewExpression, UnaryExpression, UpdateExpression, BinaryExpression, LogicalExpression,
                ConditionalExpression, AssignmentExpression, FunctionExpression, AwaitExpression,
                YieldExpression, SpreadElement, ThisExpression, JsxElement, JsxFragment,
                JsxEmptyExpression, UnsupportedNode {
}
