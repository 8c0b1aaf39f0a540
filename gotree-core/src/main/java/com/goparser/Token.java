package com.goparser;

public record Token(
    TokenType type,
    String lexeme,
    int position,
    int endPosition,
    int line,
    int column,
    int endLine
) {
    /**
     * True for a semicolon the lexer inserted at a newline or at end of file.
     */
    public boolean isImplicitSemicolon() {
        return type == TokenType.SEMICOLON && !lexeme.equals(";");
    }

    /**
     * Human-readable description used in error messages.
     */
    public String describe() {
        return switch (type) {
            case EOF -> "EOF";
            case SEMICOLON -> isImplicitSemicolon() ? "newline" : "';'";
            case IDENT, INT, FLOAT, IMAG, CHAR, STRING -> type.name().toLowerCase() + " " + lexeme;
            default -> "'" + lexeme + "'";
        };
    }
}
