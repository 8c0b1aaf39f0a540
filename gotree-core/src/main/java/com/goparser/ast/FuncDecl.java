package com.goparser.ast;

public record FuncDecl(
    CommentGroup doc,
    FieldList recv,  // Null for plain functions
    Ident name,
    FuncType type,
    BlockStmt body   // Null for external (assembly) functions
) implements Decl {
    @Override
    public NodeKind kind() {
        return NodeKind.FUNC_DECL;
    }
}
