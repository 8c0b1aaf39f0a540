package com.goparser.ast;

import java.util.List;

public record CallExpr(
    Expr fun,
    List<Expr> args,
    boolean hasEllipsis
) implements Expr {
    @Override
    public NodeKind kind() {
        return NodeKind.CALL_EXPR;
    }
}
