package com.goparser.ast;

public record BadDecl() implements Decl {
    @Override
    public NodeKind kind() {
        return NodeKind.BAD_DECL;
    }
}
