package com.goparser.ast;

public record KeyValueExpr(
    Expr key,
    Expr value
) implements Expr {
    @Override
    public NodeKind kind() {
        return NodeKind.KEY_VALUE_EXPR;
    }
}
