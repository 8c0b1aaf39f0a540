package com.goparser.ast;

public record Comment(String text) implements Node {
    @Override
    public NodeKind kind() {
        return NodeKind.COMMENT;
    }
}
