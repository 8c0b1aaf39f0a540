package com.goparser.ast;

public record IncDecStmt(
    Expr x,
    String op
) implements Stmt {
    @Override
    public NodeKind kind() {
        return NodeKind.INC_DEC_STMT;
    }
}
