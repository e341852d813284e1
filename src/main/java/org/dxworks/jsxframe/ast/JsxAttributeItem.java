package org.dxworks.jsxframe.ast;

public sealed interface JsxAttributeItem extends Node permits JsxAttribute, JsxSpreadAttribute {
}
