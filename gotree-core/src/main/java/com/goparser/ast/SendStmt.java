package com.goparser.ast;

public record SendStmt(
    Expr chan,
    Expr value
) implements Stmt {
    @Override
    public NodeKind kind() {
        return NodeKind.SEND_STMT;
    }
}
