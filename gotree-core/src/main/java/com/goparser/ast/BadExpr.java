package com.goparser.ast;

public record BadExpr() implements Expr {
    @Override
    public NodeKind kind() {
        return NodeKind.BAD_EXPR;
    }
}
