package com.goparser.ast;

import java.util.List;

public record BlockStmt(List<Stmt> list) implements Stmt {
    @Override
    public NodeKind kind() {
        return NodeKind.BLOCK_STMT;
    }
}
