package com.goparser.ast;

public record BranchStmt(
    String keyword,  // break, continue, goto or fallthrough
    Ident label      // Can be null
) implements Stmt {
    @Override
    public NodeKind kind() {
        return NodeKind.BRANCH_STMT;
    }
}
