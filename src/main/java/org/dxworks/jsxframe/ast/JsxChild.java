package org.dxworks.jsxframe.ast;

public sealed interface JsxChild extends Node
        permits JsxText, JsxExpressionContainer, JsxElement, JsxFragment {
}
