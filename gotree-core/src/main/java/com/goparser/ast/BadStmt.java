package com.goparser.ast;

public record BadStmt() implements Stmt {
    @Override
    public NodeKind kind() {
        return NodeKind.BAD_STMT;
    }
}
