package com.goparser.ast;

public record SelectStmt(BlockStmt body) implements Stmt {
    @Override
    public NodeKind kind() {
        return NodeKind.SELECT_STMT;
    }
}
