package com.goparser;

public enum TokenType {
    EOF,

    // Identifiers and basic literals
    IDENT,
    INT,
    FLOAT,
    IMAG,
    CHAR,
    STRING,

    // Operators
    ADD, SUB, MUL, QUO, REM,                    // + - * / %
    AND, OR, XOR, SHL, SHR, AND_NOT,            // & | ^ << >> &^
    ADD_ASSIGN, SUB_ASSIGN, MUL_ASSIGN, QUO_ASSIGN, REM_ASSIGN,
    AND_ASSIGN, OR_ASSIGN, XOR_ASSIGN, SHL_ASSIGN, SHR_ASSIGN, AND_NOT_ASSIGN,
    LAND, LOR, ARROW, INC, DEC,                 // && || <- ++ --
    EQL, LSS, GTR, ASSIGN, NOT,                 // == < > = !
    NEQ, LEQ, GEQ, DEFINE, ELLIPSIS,            // != <= >= := ...
    TILDE,                                      // ~

    // Delimiters
    LPAREN, LBRACK, LBRACE, COMMA, PERIOD,
    RPAREN, RBRACK, RBRACE, SEMICOLON, COLON,

    // Keywords
    BREAK, CASE, CHAN, CONST, CONTINUE,
    DEFAULT, DEFER, ELSE, FALLTHROUGH, FOR,
    FUNC, GO, GOTO, IF, IMPORT,
    INTERFACE, MAP, PACKAGE, RANGE, RETURN,
    SELECT, STRUCT, SWITCH, TYPE, VAR;

    /**
     * Binary operator precedence, or 0 for tokens that are not binary operators.
     */
    public int precedence() {
        return switch (this) {
            case LOR -> 1;
            case LAND -> 2;
            case EQL, NEQ, LSS, LEQ, GTR, GEQ -> 3;
            case ADD, SUB, OR, XOR -> 4;
            case MUL, QUO, REM, SHL, SHR, AND, AND_NOT -> 5;
            default -> 0;
        };
    }

    public boolean isAssignOp() {
        return switch (this) {
            case ASSIGN, DEFINE, ADD_ASSIGN, SUB_ASSIGN, MUL_ASSIGN, QUO_ASSIGN, REM_ASSIGN,
                 AND_ASSIGN, OR_ASSIGN, XOR_ASSIGN, SHL_ASSIGN, SHR_ASSIGN, AND_NOT_ASSIGN -> true;
            default -> false;
        };
    }
}
