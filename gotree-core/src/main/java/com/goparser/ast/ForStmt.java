package com.goparser.ast;

public record ForStmt(
    Stmt init,  // Can be null
    Expr cond,  // Can be null
    Stmt post,  // Can be null
    BlockStmt body
) implements Stmt {
    @Override
    public NodeKind kind() {
        return NodeKind.FOR_STMT;
    }
}
