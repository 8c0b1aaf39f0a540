package com.goparser.ast;

public record ArrayType(
    Expr len,  // Null for slice types
    Expr elt
) implements Expr {
    @Override
    public NodeKind kind() {
        return NodeKind.ARRAY_TYPE;
    }
}
