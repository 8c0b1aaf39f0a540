package com.goparser.ast;

public record StarExpr(Expr x) implements Expr {
    @Override
    public NodeKind kind() {
        return NodeKind.STAR_EXPR;
    }
}
