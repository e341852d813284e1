package org.dxworks.jsxframe.ast;

public sealed interface ObjectMember extends Node permits ObjectProperty, SpreadElement, RestElement {
}
