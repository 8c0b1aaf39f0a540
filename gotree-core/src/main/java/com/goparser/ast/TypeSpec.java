package com.goparser.ast;

public record TypeSpec(
    CommentGroup doc,
    Ident name,
    FieldList typeParams,  // Null unless generic
    boolean alias,
    Expr type,
    CommentGroup comment
) implements Spec {
    @Override
    public NodeKind kind() {
        return NodeKind.TYPE_SPEC;
    }
}
