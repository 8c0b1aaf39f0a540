package com.goparser.ast;

/**
 * A literal of basic type. {@code value} is the literal exactly as written,
 * quotes and prefixes included.
 */
public record BasicLit(
    LitKind litKind,
    String value
) implements Expr {
    @Override
    public NodeKind kind() {
        return NodeKind.BASIC_LIT;
    }

    public enum LitKind {
        INT, FLOAT, IMAG, CHAR, STRING
    }
}
