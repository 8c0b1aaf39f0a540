package com.goparser.ast;

public record MapType(
    Expr key,
    Expr value
) implements Expr {
    @Override
    public NodeKind kind() {
        return NodeKind.MAP_TYPE;
    }
}
