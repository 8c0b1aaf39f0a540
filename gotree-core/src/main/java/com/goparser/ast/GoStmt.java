package com.goparser.ast;

public record GoStmt(CallExpr call) implements Stmt {
    @Override
    public NodeKind kind() {
        return NodeKind.GO_STMT;
    }
}
