package com.goparser.ast;

import java.util.List;

public record CompositeLit(
    Expr type,  // Null for elided types in nested literals
    List<Expr> elts
) implements Expr {
    @Override
    public NodeKind kind() {
        return NodeKind.COMPOSITE_LIT;
    }
}
