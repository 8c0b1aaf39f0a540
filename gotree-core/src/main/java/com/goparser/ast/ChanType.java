package com.goparser.ast;

public record ChanType(
    Dir dir,
    Expr value
) implements Expr {
    @Override
    public NodeKind kind() {
        return NodeKind.CHAN_TYPE;
    }

    public enum Dir {
        SEND, RECV, BOTH
    }
}
