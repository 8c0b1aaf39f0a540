package com.goparser.ast;

public record IndexExpr(
    Expr x,
    Expr index
) implements Expr {
    @Override
    public NodeKind kind() {
        return NodeKind.INDEX_EXPR;
    }
}
