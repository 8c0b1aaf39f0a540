package com.goparser.generic;

import com.goparser.ast.NodeKind;

/**
 * Thrown when a syntax node outside the generic tree schema is classified.
 */
public class UnsupportedNodeKindException extends RuntimeException {
    private final NodeKind kind;

    public UnsupportedNodeKindException(NodeKind kind) {
        super("Unsupported node kind: " + kind.tag());
        this.kind = kind;
    }

    public NodeKind kind() {
        return kind;
    }
}
