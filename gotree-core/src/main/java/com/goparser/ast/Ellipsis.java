package com.goparser.ast;

public record Ellipsis(
    Expr elt  // Can be null in [...]T array lengths
) implements Expr {
    @Override
    public NodeKind kind() {
        return NodeKind.ELLIPSIS;
    }
}
