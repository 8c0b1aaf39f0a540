package com.goparser.ast;

import java.util.List;

public record IndexListExpr(
    Expr x,
    List<Expr> indices
) implements Expr {
    @Override
    public NodeKind kind() {
        return NodeKind.INDEX_LIST_EXPR;
    }
}
