package com.goparser.ast;

public record TypeSwitchStmt(
    Stmt init,    // Can be null
    Stmt assign,  // x := y.(type) or y.(type)
    BlockStmt body
) implements Stmt {
    @Override
    public NodeKind kind() {
        return NodeKind.TYPE_SWITCH_STMT;
    }
}
