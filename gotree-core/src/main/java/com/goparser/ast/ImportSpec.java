package com.goparser.ast;

public record ImportSpec(
    CommentGroup doc,
    Ident name,  // Local name, . or _; can be null
    BasicLit path,
    CommentGroup comment
) implements Spec {
    @Override
    public NodeKind kind() {
        return NodeKind.IMPORT_SPEC;
    }
}
