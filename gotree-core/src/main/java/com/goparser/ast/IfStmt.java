package com.goparser.ast;

public record IfStmt(
    Stmt init,  // Can be null
    Expr cond,
    BlockStmt body,
    Stmt els    // Null, an IfStmt or a BlockStmt
) implements Stmt {
    @Override
    public NodeKind kind() {
        return NodeKind.IF_STMT;
    }
}
