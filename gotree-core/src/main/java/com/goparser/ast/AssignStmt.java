package com.goparser.ast;

import java.util.List;

public record AssignStmt(
    List<Expr> lhs,
    String op,
    List<Expr> rhs
) implements Stmt {
    @Override
    public NodeKind kind() {
        return NodeKind.ASSIGN_STMT;
    }
}
