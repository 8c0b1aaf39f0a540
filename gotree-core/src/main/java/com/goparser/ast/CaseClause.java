package com.goparser.ast;

import java.util.List;

public record CaseClause(
    List<Expr> list,  // Empty for default
    List<Stmt> body
) implements Stmt {
    public boolean isDefault() {
        return list.isEmpty();
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CASE_CLAUSE;
    }
}
