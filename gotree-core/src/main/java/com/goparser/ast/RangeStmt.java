package com.goparser.ast;

public record RangeStmt(
    Expr key,    // Can be null
    Expr value,  // Can be null
    String op,   // :=, = or null when there is no key
    Expr x,
    BlockStmt body
) implements Stmt {
    @Override
    public NodeKind kind() {
        return NodeKind.RANGE_STMT;
    }
}
