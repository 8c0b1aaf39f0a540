package com.goparser.ast;

import java.util.List;

public record ValueSpec(
    CommentGroup doc,
    List<Ident> names,
    Expr type,  // Can be null
    List<Expr> values,
    CommentGroup comment
) implements Spec {
    @Override
    public NodeKind kind() {
        return NodeKind.VALUE_SPEC;
    }
}
