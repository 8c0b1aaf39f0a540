package com.goparser.ast;

public record SelectorExpr(
    Expr x,
    Ident sel
) implements Expr {
    @Override
    public NodeKind kind() {
        return NodeKind.SELECTOR_EXPR;
    }
}
