package org.dxworks.jsxframe.ast;

public sealed interface TypeNode extends Node
        permits TsKeywordType, TsArrayType, TsTypeReference, TsTypeLiteral, TsUnknownType {
}
