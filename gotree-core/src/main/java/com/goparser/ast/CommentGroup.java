package com.goparser.ast;

import java.util.List;

/**
 * A sequence of comments with no other tokens and no empty lines between them.
 */
public record CommentGroup(List<Comment> list) implements Node {
    @Override
    public NodeKind kind() {
        return NodeKind.COMMENT_GROUP;
    }
}
