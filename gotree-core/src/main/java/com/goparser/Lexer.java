package com.goparser;

import com.goparser.ast.Comment;
import com.goparser.ast.CommentGroup;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Go lexer. Turns source text into a token list ending with {@link TokenType#EOF}.
 *
 * <p>Semicolons are inserted after the last token of a line following Go's
 * semicolon rules. Comments are not part of the token list; they are
 * collected into {@link CommentBlock}s that record which tokens surround them so
 * the parser can attach documentation and line comments.</p>
 */
public class Lexer {

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
        Map.entry("break", TokenType.BREAK),
        Map.entry("case", TokenType.CASE),
        Map.entry("chan", TokenType.CHAN),
        Map.entry("const", TokenType.CONST),
        Map.entry("continue", TokenType.CONTINUE),
        Map.entry("default", TokenType.DEFAULT),
        Map.entry("defer", TokenType.DEFER),
        Map.entry("else", TokenType.ELSE),
        Map.entry("fallthrough", TokenType.FALLTHROUGH),
        Map.entry("for", TokenType.FOR),
        Map.entry("func", TokenType.FUNC),
        Map.entry("go", TokenType.GO),
        Map.entry("goto", TokenType.GOTO),
        Map.entry("if", TokenType.IF),
        Map.entry("import", TokenType.IMPORT),
        Map.entry("interface", TokenType.INTERFACE),
        Map.entry("map", TokenType.MAP),
        Map.entry("package", TokenType.PACKAGE),
        Map.entry("range", TokenType.RANGE),
        Map.entry("return", TokenType.RETURN),
        Map.entry("select", TokenType.SELECT),
        Map.entry("struct", TokenType.STRUCT),
        Map.entry("switch", TokenType.SWITCH),
        Map.entry("type", TokenType.TYPE),
        Map.entry("var", TokenType.VAR)
    );

    /**
     * A comment group together with its placement among the tokens.
     *
     * @param group     the comments
     * @param line      line of the first comment
     * @param endLine   line on which the last comment ends
     * @param prevToken index of the last non-inserted token before the group, or -1
     * @param nextToken index of the first non-inserted token after the group
     * @param trailing  true if the group starts on the line of {@code prevToken}
     */
    public record CommentBlock(
        CommentGroup group,
        int line,
        int endLine,
        int prevToken,
        int nextToken,
        boolean trailing
    ) {}

    private final String source;
    private final char[] buf;
    private final List<Token> tokens = new ArrayList<>();
    private final List<CommentBlock> commentBlocks = new ArrayList<>();

    private int pos = 0;
    private int line = 1;
    private static final char BOM = 0xFEFF;

    private int lineStart = 0;
    private boolean insertSemi = false;

    // Comment group under construction
    private List<Comment> openGroup;
    private int openGroupLine;
    private int openGroupEndLine;
    private int openGroupPrevToken;
    private boolean openGroupTrailing;
    private int lastRealTokenLine = 0;

    public Lexer(String source) {
        this.source = source;
        this.buf = source.toCharArray();
    }

    public List<Token> tokenize() {
        if (!tokens.isEmpty()) {
            return tokens;
        }
        if (buf.length > 0 && buf[0] == BOM) {
            // A leading byte order mark is ignored
            pos = 1;
            lineStart = 1;
        }
        while (true) {
            skipWhitespace();
            if (pos >= buf.length) {
                if (insertSemi) {
                    emit(TokenType.SEMICOLON, "\n", pos, pos);
                    insertSemi = false;
                }
                closeCommentGroup();
                emit(TokenType.EOF, "", pos, pos);
                break;
            }
            char c = buf[pos];
            if (c == '\n') {
                if (insertSemi) {
                    emit(TokenType.SEMICOLON, "\n", pos, pos + 1);
                    insertSemi = false;
                }
                newline(pos);
                pos++;
                continue;
            }
            if (c == '/' && peekChar(1) == '/') {
                scanLineComment();
                continue;
            }
            if (c == '/' && peekChar(1) == '*') {
                scanBlockComment();
                continue;
            }
            scanToken();
        }
        resolveCommentNeighbours();
        return tokens;
    }

    /**
     * Comment groups of the source, in order. Only valid after {@link #tokenize()}.
     */
    public List<CommentBlock> comments() {
        return commentBlocks;
    }

    // ==================== Tokens ====================

    private void scanToken() {
        int start = pos;
        char c = buf[pos];

        if (isLetter(c)) {
            while (pos < buf.length && (isLetter(buf[pos]) || isDigit(buf[pos]))) {
                pos++;
            }
            String word = source.substring(start, pos);
            TokenType keyword = KEYWORDS.get(word);
            TokenType type = keyword != null ? keyword : TokenType.IDENT;
            insertSemi = type == TokenType.IDENT
                || type == TokenType.BREAK
                || type == TokenType.CONTINUE
                || type == TokenType.FALLTHROUGH
                || type == TokenType.RETURN;
            emit(type, word, start, pos);
            return;
        }

        if (isDigit(c) || (c == '.' && isDigit(peekChar(1)))) {
            TokenType type = scanNumber();
            insertSemi = true;
            emit(type, source.substring(start, pos), start, pos);
            return;
        }

        switch (c) {
            case '"' -> {
                scanInterpretedString();
                insertSemi = true;
                emit(TokenType.STRING, source.substring(start, pos), start, pos);
                return;
            }
            case '`' -> {
                int startLine = line;
                int startCol = start - lineStart + 1;
                scanRawString();
                insertSemi = true;
                String literal = stripCarriageReturns(source.substring(start, pos));
                tokens.add(new Token(TokenType.STRING, literal, start, pos, startLine, startCol, line));
                tokenEmitted(line);
                return;
            }
            case '\'' -> {
                scanRune();
                insertSemi = true;
                emit(TokenType.CHAR, source.substring(start, pos), start, pos);
                return;
            }
            default -> {
                // operators below
            }
        }

        TokenType type = scanOperator();
        insertSemi = type == TokenType.RPAREN
            || type == TokenType.RBRACK
            || type == TokenType.RBRACE
            || type == TokenType.INC
            || type == TokenType.DEC;
        emit(type, source.substring(start, pos), start, pos);
    }

    private TokenType scanOperator() {
        char c = buf[pos++];
        return switch (c) {
            case '(' -> TokenType.LPAREN;
            case ')' -> TokenType.RPAREN;
            case '[' -> TokenType.LBRACK;
            case ']' -> TokenType.RBRACK;
            case '{' -> TokenType.LBRACE;
            case '}' -> TokenType.RBRACE;
            case ',' -> TokenType.COMMA;
            case ';' -> TokenType.SEMICOLON;
            case '~' -> TokenType.TILDE;
            case '.' -> {
                if (peekChar(0) == '.' && peekChar(1) == '.') {
                    pos += 2;
                    yield TokenType.ELLIPSIS;
                }
                yield TokenType.PERIOD;
            }
            case ':' -> take('=') ? TokenType.DEFINE : TokenType.COLON;
            case '+' -> take('+') ? TokenType.INC : take('=') ? TokenType.ADD_ASSIGN : TokenType.ADD;
            case '-' -> take('-') ? TokenType.DEC : take('=') ? TokenType.SUB_ASSIGN : TokenType.SUB;
            case '*' -> take('=') ? TokenType.MUL_ASSIGN : TokenType.MUL;
            case '/' -> take('=') ? TokenType.QUO_ASSIGN : TokenType.QUO;
            case '%' -> take('=') ? TokenType.REM_ASSIGN : TokenType.REM;
            case '^' -> take('=') ? TokenType.XOR_ASSIGN : TokenType.XOR;
            case '=' -> take('=') ? TokenType.EQL : TokenType.ASSIGN;
            case '!' -> take('=') ? TokenType.NEQ : TokenType.NOT;
            case '|' -> take('|') ? TokenType.LOR : take('=') ? TokenType.OR_ASSIGN : TokenType.OR;
            case '&' -> {
                if (take('&')) {
                    yield TokenType.LAND;
                }
                if (take('^')) {
                    yield take('=') ? TokenType.AND_NOT_ASSIGN : TokenType.AND_NOT;
                }
                yield take('=') ? TokenType.AND_ASSIGN : TokenType.AND;
            }
            case '<' -> {
                if (take('-')) {
                    yield TokenType.ARROW;
                }
                if (take('<')) {
                    yield take('=') ? TokenType.SHL_ASSIGN : TokenType.SHL;
                }
                yield take('=') ? TokenType.LEQ : TokenType.LSS;
            }
            case '>' -> {
                if (take('>')) {
                    yield take('=') ? TokenType.SHR_ASSIGN : TokenType.SHR;
                }
                yield take('=') ? TokenType.GEQ : TokenType.GTR;
            }
            default -> throw error("invalid character " + describeChar(c), pos - 1);
        };
    }

    private TokenType scanNumber() {
        TokenType type = TokenType.INT;
        if (buf[pos] == '0' && pos + 1 < buf.length) {
            char prefix = Character.toLowerCase(buf[pos + 1]);
            if (prefix == 'x') {
                pos += 2;
                skipDigits(16);
                if (peekChar(0) == '.') {
                    pos++;
                    skipDigits(16);
                    type = TokenType.FLOAT;
                }
                if (peekChar(0) == 'p' || peekChar(0) == 'P') {
                    scanExponent();
                    type = TokenType.FLOAT;
                }
                return imaginarySuffix(type);
            }
            if (prefix == 'b' || prefix == 'o') {
                pos += 2;
                skipDigits(prefix == 'b' ? 2 : 8);
                return imaginarySuffix(type);
            }
        }
        skipDigits(10);
        if (peekChar(0) == '.') {
            pos++;
            skipDigits(10);
            type = TokenType.FLOAT;
        }
        if (peekChar(0) == 'e' || peekChar(0) == 'E') {
            scanExponent();
            type = TokenType.FLOAT;
        }
        return imaginarySuffix(type);
    }

    private void scanExponent() {
        int start = pos;
        pos++;
        if (peekChar(0) == '+' || peekChar(0) == '-') {
            pos++;
        }
        if (!isDigit(peekChar(0))) {
            throw error("exponent has no digits", start);
        }
        skipDigits(10);
    }

    private TokenType imaginarySuffix(TokenType type) {
        if (peekChar(0) == 'i') {
            pos++;
            return TokenType.IMAG;
        }
        return type;
    }

    private void skipDigits(int base) {
        while (pos < buf.length) {
            char c = buf[pos];
            if (c == '_' || Character.digit(c, base) >= 0) {
                pos++;
            } else {
                break;
            }
        }
    }

    private void scanInterpretedString() {
        int start = pos;
        pos++;
        while (true) {
            if (pos >= buf.length || buf[pos] == '\n') {
                throw error("string literal not terminated", start);
            }
            char c = buf[pos++];
            if (c == '"') {
                return;
            }
            if (c == '\\' && pos < buf.length) {
                pos++;
            }
        }
    }

    private void scanRawString() {
        int start = pos;
        pos++;
        while (true) {
            if (pos >= buf.length) {
                throw error("raw string literal not terminated", start);
            }
            char c = buf[pos];
            if (c == '`') {
                pos++;
                return;
            }
            if (c == '\n') {
                newline(pos);
            }
            pos++;
        }
    }

    // Raw strings and comments drop the carriage returns of CRLF line endings
    private static String stripCarriageReturns(String text) {
        return text.indexOf('\r') < 0 ? text : text.replace("\r", "");
    }

    private void scanRune() {
        int start = pos;
        pos++;
        int n = 0;
        while (true) {
            if (pos >= buf.length || buf[pos] == '\n') {
                throw error("rune literal not terminated", start);
            }
            char c = buf[pos++];
            if (c == '\'') {
                break;
            }
            if (c == '\\' && pos < buf.length) {
                pos++;
            }
            n++;
        }
        if (n == 0) {
            throw error("empty rune literal or unescaped ' in rune literal", start);
        }
    }

    // ==================== Comments ====================

    private void scanLineComment() {
        int start = pos;
        while (pos < buf.length && buf[pos] != '\n') {
            pos++;
        }
        String text = source.substring(start, pos);
        if (text.endsWith("\r")) {
            text = text.substring(0, text.length() - 1);
        }
        addComment(text, line, line);
    }

    private void scanBlockComment() {
        int start = pos;
        int startLine = line;
        boolean hasNewline = false;
        pos += 2;
        while (true) {
            if (pos + 1 >= buf.length) {
                throw error("comment not terminated", start);
            }
            if (buf[pos] == '*' && buf[pos + 1] == '/') {
                pos += 2;
                break;
            }
            if (buf[pos] == '\n') {
                hasNewline = true;
                newline(pos);
            }
            pos++;
        }
        if (hasNewline && insertSemi) {
            // A multi-line comment acts like a newline
            tokens.add(new Token(TokenType.SEMICOLON, "\n", start, start, startLine, start - lineStartOf(startLine, start) + 1, startLine));
            insertSemi = false;
        }
        addComment(stripCarriageReturns(source.substring(start, pos)), startLine, line);
    }

    private int lineStartOf(int targetLine, int offset) {
        if (targetLine == line) {
            return lineStart;
        }
        int i = offset;
        while (i > 0 && buf[i - 1] != '\n') {
            i--;
        }
        return i;
    }

    private void addComment(String text, int startLine, int endLine) {
        if (openGroup != null) {
            boolean adjacent = openGroupTrailing
                ? startLine == openGroupEndLine
                : startLine <= openGroupEndLine + 1;
            if (adjacent) {
                openGroup.add(new Comment(text));
                openGroupEndLine = endLine;
                return;
            }
            closeCommentGroup();
        }
        openGroup = new ArrayList<>();
        openGroup.add(new Comment(text));
        openGroupLine = startLine;
        openGroupEndLine = endLine;
        openGroupPrevToken = lastRealTokenIndex();
        openGroupTrailing = openGroupPrevToken >= 0 && lastRealTokenLine == startLine;
    }

    private void closeCommentGroup() {
        if (openGroup == null) {
            return;
        }
        // nextToken is resolved once the whole token list exists
        commentBlocks.add(new CommentBlock(new CommentGroup(List.copyOf(openGroup)),
            openGroupLine, openGroupEndLine, openGroupPrevToken, -1, openGroupTrailing));
        openGroup = null;
    }

    private void resolveCommentNeighbours() {
        for (int i = 0; i < commentBlocks.size(); i++) {
            CommentBlock block = commentBlocks.get(i);
            int next = block.prevToken() + 1;
            while (next < tokens.size() - 1 && tokens.get(next).isImplicitSemicolon()) {
                next++;
            }
            commentBlocks.set(i, new CommentBlock(block.group(), block.line(), block.endLine(),
                block.prevToken(), next, block.trailing()));
        }
    }

    private int lastRealTokenIndex() {
        for (int i = tokens.size() - 1; i >= 0; i--) {
            if (!tokens.get(i).isImplicitSemicolon()) {
                return i;
            }
        }
        return -1;
    }

    // ==================== Helpers ====================

    private void emit(TokenType type, String lexeme, int start, int end) {
        tokens.add(new Token(type, lexeme, start, end, line, start - lineStart + 1, line));
        if (type != TokenType.EOF && !(type == TokenType.SEMICOLON && !lexeme.equals(";"))) {
            tokenEmitted(line);
        }
    }

    private void tokenEmitted(int tokenLine) {
        // A real token ends any comment group in progress
        closeCommentGroup();
        lastRealTokenLine = tokenLine;
    }

    private void skipWhitespace() {
        while (pos < buf.length) {
            char c = buf[pos];
            if (c == ' ' || c == '\t' || c == '\r') {
                pos++;
            } else {
                break;
            }
        }
    }

    private void newline(int offset) {
        line++;
        lineStart = offset + 1;
    }

    private boolean take(char expected) {
        if (pos < buf.length && buf[pos] == expected) {
            pos++;
            return true;
        }
        return false;
    }

    private char peekChar(int offset) {
        int i = pos + offset;
        return i < buf.length ? buf[i] : '\0';
    }

    private static boolean isLetter(char c) {
        return c == '_' || Character.isLetter(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static String describeChar(char c) {
        return Character.isISOControl(c) ? String.format("U+%04X", (int) c) : "'" + c + "'";
    }

    private ParseException error(String message, int offset) {
        int errLine = line;
        int errLineStart = lineStart;
        if (offset < lineStart) {
            errLine = 1;
            errLineStart = 0;
            for (int i = 0; i < offset; i++) {
                if (buf[i] == '\n') {
                    errLine++;
                    errLineStart = i + 1;
                }
            }
        }
        return new ParseException(message, errLine, offset - errLineStart + 1);
    }
}
