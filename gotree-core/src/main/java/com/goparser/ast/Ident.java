package com.goparser.ast;

public record Ident(String name) implements Expr {
    public boolean isBlank() {
        return "_".equals(name);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.IDENT;
    }
}
