package com.goparser.ast;

import java.util.List;

public record Field(
    CommentGroup doc,
    List<Ident> names,  // Empty for embedded fields and unnamed parameters
    Expr type,
    BasicLit tag,       // Can be null
    CommentGroup comment
) implements Node {
    @Override
    public NodeKind kind() {
        return NodeKind.FIELD;
    }
}
