package com.goparser.ast;

import java.util.List;

/**
 * A parsed Go source file, the root of one source unit.
 */
public record File(
    CommentGroup doc,  // Package documentation; can be null
    Ident name,
    List<Decl> decls,
    List<CommentGroup> comments  // All comment groups of the file, in source order
) implements Node {
    public File(Ident name, List<Decl> decls) {
        this(null, name, decls, List.of());
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FILE;
    }
}
