package com.goparser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    private static List<TokenType> types(String source) {
        return new Lexer(source).tokenize().stream().map(Token::type).toList();
    }

    @Test
    @DisplayName("Semicolons are inserted after identifiers and return at end of line")
    void insertsSemicolonAtLineEnd() {
        assertEquals(List.of(
            TokenType.IDENT, TokenType.DEFINE, TokenType.IDENT, TokenType.SEMICOLON,
            TokenType.RETURN, TokenType.SEMICOLON,
            TokenType.EOF
        ), types("x := y\nreturn\n"));
    }

    @Test
    @DisplayName("No semicolon after an operator or an opening brace")
    void noSemicolonAfterOperator() {
        List<Token> tokens = new Lexer("a +\nb {\n}").tokenize();
        assertEquals(List.of(
            TokenType.IDENT, TokenType.ADD, TokenType.IDENT, TokenType.LBRACE, TokenType.RBRACE,
            TokenType.SEMICOLON, TokenType.EOF
        ), tokens.stream().map(Token::type).toList());
        // The final semicolon is inserted at end of file
        assertTrue(tokens.get(5).isImplicitSemicolon());
    }

    @Test
    void explicitSemicolonIsNotImplicit() {
        List<Token> tokens = new Lexer("a; b").tokenize();
        assertEquals(TokenType.SEMICOLON, tokens.get(1).type());
        assertFalse(tokens.get(1).isImplicitSemicolon());
    }

    @Test
    void scansNumberAndStringLiterals() {
        List<Token> tokens = new Lexer("0x1F 1.5 1e9 3i 0b101 0o17 1_000 'a' \"s\\\"q\" `raw`").tokenize();
        assertEquals(List.of(
            TokenType.INT, TokenType.FLOAT, TokenType.FLOAT, TokenType.IMAG, TokenType.INT,
            TokenType.INT, TokenType.INT, TokenType.CHAR, TokenType.STRING, TokenType.STRING,
            TokenType.SEMICOLON, TokenType.EOF
        ), tokens.stream().map(Token::type).toList());
        assertEquals("\"s\\\"q\"", tokens.get(8).lexeme());
        assertEquals("`raw`", tokens.get(9).lexeme());
        assertEquals("1_000", tokens.get(6).lexeme());
    }

    @Test
    void scansLongestOperators() {
        assertEquals(List.of(
            TokenType.AND_NOT_ASSIGN, TokenType.SHL_ASSIGN, TokenType.ARROW, TokenType.ELLIPSIS,
            TokenType.LAND, TokenType.INC, TokenType.SEMICOLON, TokenType.EOF
        ), types("&^= <<= <- ... && ++"));
    }

    @Test
    void rawStringSpanningLinesTracksLines() {
        List<Token> tokens = new Lexer("x = `a\nb`\ny").tokenize();
        Token raw = tokens.get(2);
        assertEquals(1, raw.line());
        assertEquals(2, raw.endLine());
        Token y = tokens.get(4);
        assertEquals("y", y.lexeme());
        assertEquals(3, y.line());
    }

    @Test
    void rawStringDropsCarriageReturns() {
        List<Token> tokens = new Lexer("x = `a\r\nb`\r\n").tokenize();
        assertEquals("`a\nb`", tokens.get(2).lexeme());
        assertEquals(TokenType.SEMICOLON, tokens.get(3).type());
    }

    @Test
    void leadingByteOrderMarkIsSkipped() {
        List<Token> tokens = new Lexer("\uFEFFpackage p\n").tokenize();
        assertEquals(TokenType.PACKAGE, tokens.get(0).type());
        assertEquals(1, tokens.get(0).line());
        assertEquals(1, tokens.get(0).column());
        assertEquals("p", Parser.parse("\uFEFFpackage p\n").name().name());
    }

    @Test
    @DisplayName("Adjacent line comments form one group; a blank line starts a new one")
    void groupsComments() {
        Lexer lexer = new Lexer("package p\n\n// a\n// b\n\n// c\nvar x int // trailing\n");
        List<Token> tokens = lexer.tokenize();
        List<Lexer.CommentBlock> blocks = lexer.comments();

        assertEquals(3, blocks.size());
        assertEquals(2, blocks.get(0).group().list().size());
        assertEquals("// a", blocks.get(0).group().list().get(0).text());
        assertEquals(3, blocks.get(0).line());
        assertEquals(4, blocks.get(0).endLine());

        Lexer.CommentBlock doc = blocks.get(1);
        assertEquals("// c", doc.group().list().get(0).text());
        assertFalse(doc.trailing());
        assertEquals(TokenType.VAR, tokens.get(doc.nextToken()).type());

        Lexer.CommentBlock trailing = blocks.get(2);
        assertTrue(trailing.trailing());
        assertEquals("int", tokens.get(trailing.prevToken()).lexeme());
        assertEquals(TokenType.EOF, tokens.get(trailing.nextToken()).type());
    }

    @Test
    void multiLineBlockCommentActsAsNewline() {
        assertEquals(List.of(
            TokenType.IDENT, TokenType.SEMICOLON, TokenType.IDENT, TokenType.SEMICOLON, TokenType.EOF
        ), types("x /* one\ntwo */ y"));
    }

    @Test
    void reportsUnterminatedString() {
        ParseException e = assertThrows(ParseException.class, () -> new Lexer("x := \"abc").tokenize());
        assertEquals(1, e.line());
        assertEquals(6, e.column());
        assertEquals("1:6: string literal not terminated", e.getMessage());
    }

    @Test
    void reportsInvalidCharacter() {
        ParseException e = assertThrows(ParseException.class, () -> new Lexer("a\nb ? c").tokenize());
        assertEquals(2, e.line());
        assertEquals(3, e.column());
    }
}
