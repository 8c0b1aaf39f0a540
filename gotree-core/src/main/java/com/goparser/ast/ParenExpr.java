package com.goparser.ast;

public record ParenExpr(Expr x) implements Expr {
    @Override
    public NodeKind kind() {
        return NodeKind.PAREN_EXPR;
    }
}
