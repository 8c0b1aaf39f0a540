package com.goparser.ast;

public record DeclStmt(Decl decl) implements Stmt {
    @Override
    public NodeKind kind() {
        return NodeKind.DECL_STMT;
    }
}
