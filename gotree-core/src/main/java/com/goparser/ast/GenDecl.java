package com.goparser.ast;

import java.util.List;

/**
 * A parenthesized or single import, const, type or var declaration.
 *
 * <p>Its kind depends on the keyword: an import declaration is an
 * {@link NodeKind#IMPORT_GROUP}, a var declaration a {@link NodeKind#VAR_GROUP}, and so on.</p>
 */
public record GenDecl(
    CommentGroup doc,
    Keyword keyword,
    boolean parenthesized,
    List<Spec> specs
) implements Decl {
    @Override
    public NodeKind kind() {
        return switch (keyword) {
            case IMPORT -> NodeKind.IMPORT_GROUP;
            case CONST -> NodeKind.CONST_GROUP;
            case TYPE -> NodeKind.TYPE_GROUP;
            case VAR -> NodeKind.VAR_GROUP;
        };
    }

    public enum Keyword {
        IMPORT, CONST, TYPE, VAR
    }
}
