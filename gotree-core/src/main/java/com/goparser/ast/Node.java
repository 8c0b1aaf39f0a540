package com.goparser.ast;

/**
 * Base interface for all Go syntax tree nodes.
 *
 * <p>Nodes are identified by reference. Two structurally equal nodes are still
 * two distinct nodes of the tree.</p>
 */
public sealed interface Node permits
    Expr,
    Stmt,
    Decl,
    Spec,
    Field,
    FieldList,
    Comment,
    CommentGroup,
    File,
    Package {

    NodeKind kind();
}
