package com.goparser.ast;

public record BinaryExpr(
    Expr x,
    String op,
    Expr y
) implements Expr {
    @Override
    public NodeKind kind() {
        return NodeKind.BINARY_EXPR;
    }
}
