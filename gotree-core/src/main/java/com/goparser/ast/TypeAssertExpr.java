package com.goparser.ast;

public record TypeAssertExpr(
    Expr x,
    Expr type  // Null for x.(type) in type switches
) implements Expr {
    @Override
    public NodeKind kind() {
        return NodeKind.TYPE_ASSERT_EXPR;
    }
}
