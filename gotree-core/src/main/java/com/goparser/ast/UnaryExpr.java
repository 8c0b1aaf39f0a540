package com.goparser.ast;

public record UnaryExpr(
    String op,
    Expr x
) implements Expr {
    @Override
    public NodeKind kind() {
        return NodeKind.UNARY_EXPR;
    }
}
