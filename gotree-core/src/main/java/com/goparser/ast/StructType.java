package com.goparser.ast;

public record StructType(FieldList fields) implements Expr {
    @Override
    public NodeKind kind() {
        return NodeKind.STRUCT_TYPE;
    }
}
