package com.goparser.ast;

import java.util.List;

public record CommClause(
    Stmt comm,  // Null for default
    List<Stmt> body
) implements Stmt {
    @Override
    public NodeKind kind() {
        return NodeKind.COMM_CLAUSE;
    }
}
