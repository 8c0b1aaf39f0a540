package com.goparser;

public class UnexpectedTokenException extends ParseException {
    private final Token token;

    public UnexpectedTokenException(Token token, String expected) {
        super("expected " + expected + ", found " + token.describe(), token.line(), token.column());
        this.token = token;
    }

    public Token token() {
        return token;
    }
}
