package com.goparser.ast;

public record DeferStmt(CallExpr call) implements Stmt {
    @Override
    public NodeKind kind() {
        return NodeKind.DEFER_STMT;
    }
}
