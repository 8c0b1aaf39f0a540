package com.goparser.ast;

import java.util.List;

public record ReturnStmt(List<Expr> results) implements Stmt {
    @Override
    public NodeKind kind() {
        return NodeKind.RETURN_STMT;
    }
}
