package com.goparser;

public class ExpectedTokenException extends ParseException {
    public ExpectedTokenException(String message, Token token) {
        super(message, token.line(), token.column());
    }
}
