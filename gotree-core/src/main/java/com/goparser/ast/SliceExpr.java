package com.goparser.ast;

public record SliceExpr(
    Expr x,
    Expr low,   // Can be null
    Expr high,  // Can be null
    Expr max,   // Null unless slice3
    boolean slice3
) implements Expr {
    @Override
    public NodeKind kind() {
        return NodeKind.SLICE_EXPR;
    }
}
