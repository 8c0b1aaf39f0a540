package com.goparser.ast;

public record ExprStmt(Expr x) implements Stmt {
    @Override
    public NodeKind kind() {
        return NodeKind.EXPR_STMT;
    }
}
