package com.goparser.ast;

/**
 * A function signature, shared by declarations, literals and function types.
 */
public record FuncType(
    FieldList typeParams,  // Null unless generic
    FieldList params,
    FieldList results      // Can be null
) implements Expr {
    public FuncType(FieldList params, FieldList results) {
        this(null, params, results);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FUNC_TYPE;
    }
}
