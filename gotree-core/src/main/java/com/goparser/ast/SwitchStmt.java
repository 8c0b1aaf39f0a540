package com.goparser.ast;

public record SwitchStmt(
    Stmt init,  // Can be null
    Expr tag,   // Can be null
    BlockStmt body
) implements Stmt {
    @Override
    public NodeKind kind() {
        return NodeKind.SWITCH_STMT;
    }
}
