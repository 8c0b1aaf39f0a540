package com.goparser.ast;

public record LabeledStmt(
    Ident label,
    Stmt stmt
) implements Stmt {
    @Override
    public NodeKind kind() {
        return NodeKind.LABELED_STMT;
    }
}
