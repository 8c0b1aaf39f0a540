package com.goparser.ast;

public record FuncLit(
    FuncType type,
    BlockStmt body
) implements Expr {
    @Override
    public NodeKind kind() {
        return NodeKind.FUNC_LIT;
    }
}
