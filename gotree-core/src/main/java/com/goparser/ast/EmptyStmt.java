package com.goparser.ast;

public record EmptyStmt(
    boolean implicit  // True if the semicolon was inserted at a newline or before a closing brace
) implements Stmt {
    @Override
    public NodeKind kind() {
        return NodeKind.EMPTY_STMT;
    }
}
