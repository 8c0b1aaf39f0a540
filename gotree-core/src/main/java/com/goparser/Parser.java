package com.goparser;

import com.goparser.ast.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class Parser {

    // Simple statement parsing modes
    private static final int BASIC = 0;
    private static final int LABEL_OK = 1;
    private static final int RANGE_OK = 2;

    private final List<Token> tokens;
    private final List<Lexer.CommentBlock> comments;
    private final Map<Integer, Lexer.CommentBlock> leadComments = new HashMap<>();   // keyed by next token
    private final Map<Integer, Lexer.CommentBlock> lineComments = new HashMap<>();   // keyed by previous token
    private int current = 0;

    // < 0 while parsing a control clause header, >= 0 inside an expression.
    // A composite literal with a bare type name is only allowed when >= 0.
    private int exprLev = 0;

    public Parser(String source) {
        Lexer lexer = new Lexer(source);
        this.tokens = lexer.tokenize();
        this.comments = lexer.comments();
        for (Lexer.CommentBlock block : comments) {
            if (block.trailing()) {
                lineComments.putIfAbsent(block.prevToken(), block);
            } else {
                // Later groups win: the lead comment is the one directly above the token
                leadComments.put(block.nextToken(), block);
            }
        }
    }

    public static File parse(String source) {
        return new Parser(source).parse();
    }

    public File parse() {
        CommentGroup doc = leadComment();
        expect(TokenType.PACKAGE, "'package'");
        Ident name = parseIdent();
        if (name.isBlank()) {
            throw new ExpectedTokenException("invalid package name _", previous());
        }
        expectSemi();

        List<Decl> decls = new ArrayList<>();
        while (check(TokenType.IMPORT)) {
            decls.add(parseGenDecl(GenDecl.Keyword.IMPORT));
        }
        while (!check(TokenType.EOF)) {
            decls.add(parseDecl());
        }

        List<CommentGroup> groups = new ArrayList<>(comments.size());
        for (Lexer.CommentBlock block : comments) {
            groups.add(block.group());
        }
        return new File(doc, name, decls, groups);
    }

    // ========================================================================
    // Declarations
    // ========================================================================

    private Decl parseDecl() {
        Token token = peek();
        return switch (token.type()) {
            case CONST -> parseGenDecl(GenDecl.Keyword.CONST);
            case TYPE -> parseGenDecl(GenDecl.Keyword.TYPE);
            case VAR -> parseGenDecl(GenDecl.Keyword.VAR);
            case FUNC -> parseFuncDecl();
            case IMPORT -> throw new ExpectedTokenException("imports must appear before other declarations", token);
            default -> throw new UnexpectedTokenException(token, "declaration");
        };
    }

    private GenDecl parseGenDecl(GenDecl.Keyword keyword) {
        CommentGroup doc = leadComment();
        advance(); // keyword
        List<Spec> specs = new ArrayList<>();
        if (match(TokenType.LPAREN)) {
            int iota = 0;
            while (!check(TokenType.RPAREN) && !check(TokenType.EOF)) {
                specs.add(parseSpec(leadComment(), keyword, iota++));
            }
            expect(TokenType.RPAREN, "')'");
            expectSemi();
            return new GenDecl(doc, keyword, true, specs);
        }
        // The documentation of an unparenthesized declaration belongs to the declaration
        specs.add(parseSpec(null, keyword, 0));
        return new GenDecl(doc, keyword, false, specs);
    }

    private Spec parseSpec(CommentGroup doc, GenDecl.Keyword keyword, int iota) {
        return switch (keyword) {
            case IMPORT -> parseImportSpec(doc);
            case TYPE -> parseTypeSpec(doc);
            case CONST, VAR -> parseValueSpec(doc, keyword, iota);
        };
    }

    private ImportSpec parseImportSpec(CommentGroup doc) {
        Ident name = null;
        if (match(TokenType.PERIOD)) {
            name = new Ident(".");
        } else if (check(TokenType.IDENT)) {
            name = parseIdent();
        }
        Token pathToken = expect(TokenType.STRING, "import path");
        BasicLit path = new BasicLit(BasicLit.LitKind.STRING, pathToken.lexeme());
        CommentGroup comment = lineComment();
        expectSemi();
        return new ImportSpec(doc, name, path, comment);
    }

    private ValueSpec parseValueSpec(CommentGroup doc, GenDecl.Keyword keyword, int iota) {
        Token start = peek();
        List<Ident> names = parseIdentList();
        Expr type = null;
        List<Expr> values = List.of();
        if (!check(TokenType.ASSIGN) && !check(TokenType.SEMICOLON) && !check(TokenType.RPAREN)) {
            type = parseType();
        }
        if (match(TokenType.ASSIGN)) {
            values = parseExprList();
        }
        if (keyword == GenDecl.Keyword.VAR && type == null && values.isEmpty()) {
            throw new ExpectedTokenException("missing variable type or initialization", start);
        }
        if (keyword == GenDecl.Keyword.CONST && values.isEmpty() && (iota == 0 || type != null)) {
            throw new ExpectedTokenException("missing init expr for const declaration", start);
        }
        CommentGroup comment = lineComment();
        expectSemi();
        return new ValueSpec(doc, names, type, values, comment);
    }

    private TypeSpec parseTypeSpec(CommentGroup doc) {
        Ident name = parseIdent();
        if (check(TokenType.LBRACK) && checkAhead(1, TokenType.IDENT)) {
            return parseArrayOrGenericTypeSpec(doc, name);
        }
        boolean alias = match(TokenType.ASSIGN);
        Expr type = parseType();
        CommentGroup comment = lineComment();
        expectSemi();
        return new TypeSpec(doc, name, null, alias, type, comment);
    }

    /**
     * After {@code type T [x}: {@code x} is parsed as an expression first, and only a
     * bracket that cannot hold an array length opens a type parameter list.
     * {@code type T[P *C] ...} is an array type; {@code type T[P *C,] ...} is generic.
     */
    private TypeSpec parseArrayOrGenericTypeSpec(CommentGroup doc, Ident name) {
        expect(TokenType.LBRACK, "'['");
        Expr x = parseIdent();
        if (!check(TokenType.LBRACK)) {
            exprLev++;
            x = parseBinaryExpr(parsePrimaryExprSuffix(x), 1);
            exprLev--;
        }

        FieldList typeParams = null;
        boolean alias = false;
        Expr type;
        ParamEntry head = extractName(x, check(TokenType.COMMA));
        if (head != null && (head.type() != null || !check(TokenType.RBRACK))) {
            typeParams = parseTypeParamsAfter(head);
            alias = match(TokenType.ASSIGN);
            type = parseType();
        } else {
            expect(TokenType.RBRACK, "']'");
            type = new ArrayType(x, parseType());
        }
        CommentGroup comment = lineComment();
        expectSemi();
        return new TypeSpec(doc, name, typeParams, alias, type, comment);
    }

    /**
     * Splits {@code x} into a type parameter name and the start of its constraint.
     * {@code force} is set when a comma follows, which rules out an array length.
     *
     * @return null if {@code x} does not start a type parameter
     */
    private static ParamEntry extractName(Expr x, boolean force) {
        if (x instanceof Ident ident) {
            return new ParamEntry(ident, null);
        }
        if (x instanceof BinaryExpr binary) {
            if (binary.op().equals("*") && binary.x() instanceof Ident ident
                && (force || isTypeElem(binary.y()))) {
                return new ParamEntry(ident, new StarExpr(binary.y()));
            }
            if (binary.op().equals("|")) {
                ParamEntry lhs = extractName(binary.x(), force || isTypeElem(binary.y()));
                if (lhs != null && lhs.type() != null) {
                    return new ParamEntry(lhs.name(), new BinaryExpr(lhs.type(), "|", binary.y()));
                }
            }
            return null;
        }
        if (x instanceof CallExpr call && call.fun() instanceof Ident ident
            && call.args().size() == 1 && !call.hasEllipsis()
            && (force || isTypeElem(call.args().get(0)))) {
            return new ParamEntry(ident, new ParenExpr(call.args().get(0)));
        }
        return null;
    }

    /**
     * True if {@code x} can only be a type element, never a constant expression.
     */
    private static boolean isTypeElem(Expr x) {
        if (x instanceof ArrayType || x instanceof StructType || x instanceof FuncType
            || x instanceof InterfaceType || x instanceof MapType || x instanceof ChanType) {
            return true;
        }
        if (x instanceof BinaryExpr binary) {
            return isTypeElem(binary.x()) || isTypeElem(binary.y());
        }
        if (x instanceof UnaryExpr unary) {
            return unary.op().equals("~");
        }
        if (x instanceof ParenExpr paren) {
            return isTypeElem(paren.x());
        }
        return false;
    }

    private FuncDecl parseFuncDecl() {
        CommentGroup doc = leadComment();
        expect(TokenType.FUNC, "'func'");
        FieldList recv = null;
        if (check(TokenType.LPAREN)) {
            recv = parseParameters();
        }
        Ident name = parseIdent();
        FieldList typeParams = null;
        if (check(TokenType.LBRACK)) {
            typeParams = parseTypeParams();
        }
        FieldList params = parseParameters();
        FieldList results = parseResult();
        BlockStmt body = null;
        if (check(TokenType.LBRACE)) {
            body = parseFuncBody();
        }
        expectSemi();
        return new FuncDecl(doc, recv, name, new FuncType(typeParams, params, results), body);
    }

    // ========================================================================
    // Parameters and results
    // ========================================================================

    // One comma-separated entry of a parameter list before names and types are grouped
    private record ParamEntry(Ident name, Expr type) {}

    private FieldList parseParameters() {
        expect(TokenType.LPAREN, "'('");
        List<Field> fields = parseParameterList(TokenType.RPAREN, false, null);
        expect(TokenType.RPAREN, "')'");
        return new FieldList(fields);
    }

    private FieldList parseTypeParams() {
        Token open = expect(TokenType.LBRACK, "'['");
        List<Field> fields = parseParameterList(TokenType.RBRACK, true, null);
        expect(TokenType.RBRACK, "']'");
        if (fields.isEmpty()) {
            throw new ExpectedTokenException("empty type parameter list", open);
        }
        return new FieldList(fields);
    }

    /**
     * Completes a type parameter list whose first name, and possibly the start of its
     * constraint, has already been read.
     */
    private FieldList parseTypeParamsAfter(ParamEntry head) {
        if (head.type() == null && !check(TokenType.COMMA) && !check(TokenType.RBRACK)) {
            head = new ParamEntry(head.name(), parseConstraint());
        }
        List<Field> fields = parseParameterList(TokenType.RBRACK, true, head);
        expect(TokenType.RBRACK, "']'");
        return new FieldList(fields);
    }

    private List<Field> parseParameterList(TokenType close, boolean typeParams, ParamEntry first) {
        Token start = first != null ? previous() : peek();
        List<ParamEntry> entries = new ArrayList<>();
        boolean named = false;
        boolean more = true;
        if (first != null) {
            named = first.type() != null;
            entries.add(first);
            more = match(TokenType.COMMA);
        }
        while (more && !check(close) && !check(TokenType.EOF)) {
            ParamEntry entry = parseParamEntry(close, typeParams);
            if (entry.name() != null && entry.type() != null) {
                named = true;
            }
            entries.add(entry);
            if (!match(TokenType.COMMA)) {
                break;
            }
        }

        List<Field> fields = new ArrayList<>();
        if (named) {
            // a, b int, c string: names without a type take the type of the next typed entry
            List<Ident> names = new ArrayList<>();
            for (ParamEntry entry : entries) {
                if (entry.name() == null) {
                    throw new ExpectedTokenException("mixed named and unnamed parameters", start);
                }
                names.add(entry.name());
                if (entry.type() != null) {
                    fields.add(new Field(null, List.copyOf(names), entry.type(), null, null));
                    names.clear();
                }
            }
            if (!names.isEmpty()) {
                throw new ExpectedTokenException(typeParams ? "missing type constraint" : "missing parameter type", start);
            }
        } else {
            if (typeParams && !entries.isEmpty()) {
                throw new ExpectedTokenException("missing type constraint", start);
            }
            for (ParamEntry entry : entries) {
                Expr type = entry.type() != null ? entry.type() : entry.name();
                fields.add(new Field(null, List.of(), type, null, null));
            }
        }
        return fields;
    }

    private ParamEntry parseParamEntry(TokenType close, boolean typeParams) {
        if (check(TokenType.IDENT)) {
            Ident ident = parseIdent();
            TokenType next = peek().type();
            if (next == TokenType.PERIOD) {
                return new ParamEntry(null, parseTypeNameRest(ident));
            }
            if (next == TokenType.LBRACK) {
                return parseArrayFieldOrTypeInstance(ident);
            }
            if (next == TokenType.ELLIPSIS) {
                return new ParamEntry(ident, parseVariadic());
            }
            if (next == TokenType.COMMA || next == close) {
                return new ParamEntry(ident, null);
            }
            return new ParamEntry(ident, typeParams ? parseConstraint() : parseType());
        }
        if (check(TokenType.ELLIPSIS)) {
            return new ParamEntry(null, parseVariadic());
        }
        return new ParamEntry(null, typeParams ? parseConstraint() : parseType());
    }

    /**
     * After {@code x[}: either a name followed by an array type ({@code x [N]T}) or a
     * generic type instance ({@code x[T]}).
     */
    private ParamEntry parseArrayFieldOrTypeInstance(Ident x) {
        expect(TokenType.LBRACK, "'['");
        if (match(TokenType.RBRACK)) {
            return new ParamEntry(x, new ArrayType(null, parseType()));
        }
        List<Expr> args = new ArrayList<>();
        exprLev++;
        if (match(TokenType.ELLIPSIS)) {
            args.add(new Ellipsis(null));
        } else {
            args.add(parseExpr());
            while (match(TokenType.COMMA)) {
                if (check(TokenType.RBRACK)) {
                    break;
                }
                args.add(parseType());
            }
        }
        exprLev--;
        expect(TokenType.RBRACK, "']'");
        if (args.size() == 1 && startsType(peek().type())) {
            return new ParamEntry(x, new ArrayType(args.get(0), parseType()));
        }
        Expr instance = args.size() == 1 ? new IndexExpr(x, args.get(0)) : new IndexListExpr(x, args);
        return new ParamEntry(null, instance);
    }

    private Ellipsis parseVariadic() {
        expect(TokenType.ELLIPSIS, "'...'");
        return new Ellipsis(parseType());
    }

    private FieldList parseResult() {
        if (check(TokenType.LPAREN)) {
            return parseParameters();
        }
        if (startsType(peek().type())) {
            Expr type = parseType();
            return new FieldList(List.of(new Field(null, List.of(), type, null, null)));
        }
        return null;
    }

    private FuncType parseSignature() {
        FieldList params = parseParameters();
        FieldList results = parseResult();
        return new FuncType(params, results);
    }

    // ========================================================================
    // Types
    // ========================================================================

    private static boolean startsType(TokenType type) {
        return switch (type) {
            case IDENT, LBRACK, STRUCT, MUL, FUNC, INTERFACE, MAP, CHAN, LPAREN, ARROW -> true;
            default -> false;
        };
    }

    private Expr parseType() {
        Expr type = tryType();
        if (type == null) {
            throw new UnexpectedTokenException(peek(), "type");
        }
        return type;
    }

    private Expr tryType() {
        return switch (peek().type()) {
            case IDENT -> parseTypeNameRest(parseIdent());
            case LBRACK -> parseArrayType();
            case STRUCT -> parseStructType();
            case MUL -> {
                advance();
                yield new StarExpr(parseType());
            }
            case FUNC -> {
                advance();
                yield parseSignature();
            }
            case INTERFACE -> parseInterfaceType();
            case MAP -> parseMapType();
            case CHAN, ARROW -> parseChanType();
            case LPAREN -> {
                advance();
                Expr type = parseType();
                expect(TokenType.RPAREN, "')'");
                yield new ParenExpr(type);
            }
            default -> null;
        };
    }

    /**
     * Completes a type name: an optional package qualifier and optional type arguments.
     */
    private Expr parseTypeNameRest(Ident ident) {
        Expr type = ident;
        if (match(TokenType.PERIOD)) {
            type = new SelectorExpr(ident, parseIdent());
        }
        if (check(TokenType.LBRACK)) {
            advance();
            exprLev++;
            List<Expr> args = new ArrayList<>();
            args.add(parseType());
            while (match(TokenType.COMMA)) {
                if (check(TokenType.RBRACK)) {
                    break;
                }
                args.add(parseType());
            }
            exprLev--;
            expect(TokenType.RBRACK, "']'");
            type = args.size() == 1 ? new IndexExpr(type, args.get(0)) : new IndexListExpr(type, args);
        }
        return type;
    }

    private ArrayType parseArrayType() {
        expect(TokenType.LBRACK, "'['");
        Expr len = null;
        if (match(TokenType.ELLIPSIS)) {
            len = new Ellipsis(null);
        } else if (!check(TokenType.RBRACK)) {
            exprLev++;
            len = parseExpr();
            exprLev--;
        }
        expect(TokenType.RBRACK, "']'");
        return new ArrayType(len, parseType());
    }

    private StructType parseStructType() {
        expect(TokenType.STRUCT, "'struct'");
        expect(TokenType.LBRACE, "'{'");
        List<Field> fields = new ArrayList<>();
        while (check(TokenType.IDENT) || check(TokenType.MUL) || check(TokenType.LPAREN)) {
            fields.add(parseFieldDecl());
        }
        expect(TokenType.RBRACE, "'}'");
        return new StructType(new FieldList(fields));
    }

    private Field parseFieldDecl() {
        CommentGroup doc = leadComment();
        List<Ident> names = List.of();
        Expr type;
        if (check(TokenType.IDENT)) {
            Ident name = parseIdent();
            if (check(TokenType.PERIOD) || check(TokenType.STRING)
                || check(TokenType.SEMICOLON) || check(TokenType.RBRACE)) {
                // Embedded type
                type = parseTypeNameRest(name);
            } else if (check(TokenType.LBRACK)) {
                ParamEntry entry = parseArrayFieldOrTypeInstance(name);
                if (entry.name() != null) {
                    names = List.of(entry.name());
                }
                type = entry.type();
            } else {
                List<Ident> idents = new ArrayList<>();
                idents.add(name);
                while (match(TokenType.COMMA)) {
                    idents.add(parseIdent());
                }
                names = idents;
                type = parseType();
            }
        } else if (match(TokenType.MUL)) {
            type = new StarExpr(parseTypeNameRest(parseIdent()));
        } else {
            throw new ExpectedTokenException("cannot parenthesize embedded type", peek());
        }

        BasicLit tag = null;
        if (check(TokenType.STRING)) {
            tag = new BasicLit(BasicLit.LitKind.STRING, advance().lexeme());
        }
        CommentGroup comment = lineComment();
        expectSemi();
        return new Field(doc, names, type, tag, comment);
    }

    private InterfaceType parseInterfaceType() {
        expect(TokenType.INTERFACE, "'interface'");
        expect(TokenType.LBRACE, "'{'");
        List<Field> methods = new ArrayList<>();
        while (!check(TokenType.RBRACE) && !check(TokenType.EOF)) {
            CommentGroup doc = leadComment();
            Field field;
            if (check(TokenType.IDENT) && checkAhead(1, TokenType.LPAREN)) {
                Ident name = parseIdent();
                FuncType signature = parseSignature();
                field = new Field(doc, List.of(name), signature, null, lineComment());
            } else {
                // Embedded interface or type set element
                Expr element = parseConstraint();
                field = new Field(doc, List.of(), element, null, lineComment());
            }
            methods.add(field);
            expectSemi();
        }
        expect(TokenType.RBRACE, "'}'");
        return new InterfaceType(new FieldList(methods));
    }

    private Expr parseConstraint() {
        Expr x = parseConstraintTerm();
        while (check(TokenType.OR)) {
            Token op = advance();
            x = new BinaryExpr(x, op.lexeme(), parseConstraintTerm());
        }
        return x;
    }

    private Expr parseConstraintTerm() {
        if (check(TokenType.TILDE)) {
            Token op = advance();
            return new UnaryExpr(op.lexeme(), parseType());
        }
        return parseType();
    }

    private MapType parseMapType() {
        expect(TokenType.MAP, "'map'");
        expect(TokenType.LBRACK, "'['");
        Expr key = parseType();
        expect(TokenType.RBRACK, "']'");
        return new MapType(key, parseType());
    }

    private ChanType parseChanType() {
        ChanType.Dir dir = ChanType.Dir.BOTH;
        if (match(TokenType.CHAN)) {
            if (match(TokenType.ARROW)) {
                dir = ChanType.Dir.SEND;
            }
        } else {
            expect(TokenType.ARROW, "'<-'");
            expect(TokenType.CHAN, "'chan'");
            dir = ChanType.Dir.RECV;
        }
        return new ChanType(dir, parseType());
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    private List<Expr> parseExprList() {
        List<Expr> list = new ArrayList<>();
        list.add(parseExpr());
        while (match(TokenType.COMMA)) {
            list.add(parseExpr());
        }
        return list;
    }

    private Expr parseExpr() {
        return parseBinaryExpr(1);
    }

    private Expr parseBinaryExpr(int minPrec) {
        return parseBinaryExpr(parseUnaryExpr(), minPrec);
    }

    // Continues a binary expression whose leftmost operand is already parsed
    private Expr parseBinaryExpr(Expr x, int minPrec) {
        while (true) {
            Token op = peek();
            int prec = op.type().precedence();
            if (prec < minPrec) {
                return x;
            }
            advance();
            Expr y = parseBinaryExpr(prec + 1);
            x = new BinaryExpr(x, op.lexeme(), y);
        }
    }

    private Expr parseUnaryExpr() {
        Token token = peek();
        return switch (token.type()) {
            case ADD, SUB, NOT, XOR, AND, TILDE -> {
                advance();
                yield new UnaryExpr(token.lexeme(), parseUnaryExpr());
            }
            case ARROW -> {
                if (checkAhead(1, TokenType.CHAN)) {
                    // <-chan T, possibly converted: (<-chan T)(x) written without parens
                    yield parsePrimaryExprSuffix(parseChanType());
                }
                advance();
                yield new UnaryExpr(token.lexeme(), parseUnaryExpr());
            }
            case MUL -> {
                advance();
                yield new StarExpr(parseUnaryExpr());
            }
            default -> parsePrimaryExpr();
        };
    }

    private Expr parsePrimaryExpr() {
        return parsePrimaryExprSuffix(parseOperand());
    }

    private Expr parseOperand() {
        Token token = peek();
        return switch (token.type()) {
            case IDENT -> parseIdent();
            case INT, FLOAT, IMAG, CHAR, STRING -> {
                advance();
                yield new BasicLit(litKind(token.type()), token.lexeme());
            }
            case LPAREN -> {
                advance();
                exprLev++;
                Expr x = parseExpr();
                exprLev--;
                expect(TokenType.RPAREN, "')'");
                yield new ParenExpr(x);
            }
            case FUNC -> {
                advance();
                FuncType type = parseSignature();
                if (check(TokenType.LBRACE)) {
                    yield new FuncLit(type, parseFuncBody());
                }
                yield type;
            }
            case LBRACK, STRUCT, MAP, CHAN, INTERFACE -> parseType();
            default -> throw new UnexpectedTokenException(token, "expression");
        };
    }

    private Expr parsePrimaryExprSuffix(Expr x) {
        while (true) {
            switch (peek().type()) {
                case PERIOD -> {
                    advance();
                    if (check(TokenType.IDENT)) {
                        x = new SelectorExpr(x, parseIdent());
                    } else if (match(TokenType.LPAREN)) {
                        Expr type = null;
                        if (!match(TokenType.TYPE)) {
                            type = parseType();
                        }
                        expect(TokenType.RPAREN, "')'");
                        x = new TypeAssertExpr(x, type);
                    } else {
                        throw new UnexpectedTokenException(peek(), "selector or type assertion");
                    }
                }
                case LBRACK -> x = parseIndexOrSlice(x);
                case LPAREN -> x = parseCallOrConversion(x);
                case LBRACE -> {
                    if (!isLiteralType(x) || (exprLev < 0 && isTypeName(x))) {
                        return x;
                    }
                    x = parseLiteralValue(x);
                }
                default -> {
                    return x;
                }
            }
        }
    }

    private Expr parseIndexOrSlice(Expr x) {
        Token open = expect(TokenType.LBRACK, "'['");
        exprLev++;
        Expr[] index = new Expr[3];
        int colons = 0;
        if (!check(TokenType.COLON)) {
            index[0] = parseExpr();
        }
        while (check(TokenType.COLON) && colons < 2) {
            advance();
            colons++;
            if (!check(TokenType.COLON) && !check(TokenType.RBRACK)) {
                index[colons] = parseExpr();
            }
        }
        List<Expr> list = null;
        if (colons == 0 && check(TokenType.COMMA)) {
            list = new ArrayList<>();
            list.add(index[0]);
            while (match(TokenType.COMMA)) {
                if (check(TokenType.RBRACK)) {
                    break;
                }
                list.add(parseType());
            }
        }
        exprLev--;
        expect(TokenType.RBRACK, "']'");

        if (colons > 0) {
            boolean slice3 = colons == 2;
            if (slice3 && index[1] == null) {
                throw new ExpectedTokenException("middle index required in 3-index slice", open);
            }
            if (slice3 && index[2] == null) {
                throw new ExpectedTokenException("final index required in 3-index slice", open);
            }
            return new SliceExpr(x, index[0], index[1], index[2], slice3);
        }
        if (index[0] == null) {
            throw new ExpectedTokenException("expected operand", open);
        }
        if (list != null) {
            return new IndexListExpr(x, list);
        }
        return new IndexExpr(x, index[0]);
    }

    private CallExpr parseCallOrConversion(Expr fun) {
        expect(TokenType.LPAREN, "'('");
        exprLev++;
        List<Expr> args = new ArrayList<>();
        boolean hasEllipsis = false;
        while (!check(TokenType.RPAREN) && !check(TokenType.EOF)) {
            args.add(parseExpr());
            if (match(TokenType.ELLIPSIS)) {
                hasEllipsis = true;
            }
            if (!match(TokenType.COMMA)) {
                break;
            }
        }
        exprLev--;
        expect(TokenType.RPAREN, "')'");
        return new CallExpr(fun, args, hasEllipsis);
    }

    private CompositeLit parseLiteralValue(Expr type) {
        expect(TokenType.LBRACE, "'{'");
        exprLev++;
        List<Expr> elts = new ArrayList<>();
        while (!check(TokenType.RBRACE) && !check(TokenType.EOF)) {
            Expr element = parseElementValue();
            if (match(TokenType.COLON)) {
                element = new KeyValueExpr(element, parseElementValue());
            }
            elts.add(element);
            if (!match(TokenType.COMMA)) {
                break;
            }
        }
        exprLev--;
        if (peek().isImplicitSemicolon() && checkAhead(1, TokenType.RBRACE)) {
            throw new ExpectedTokenException("missing ',' before newline in composite literal", peek());
        }
        expect(TokenType.RBRACE, "'}'");
        return new CompositeLit(type, elts);
    }

    private Expr parseElementValue() {
        if (check(TokenType.LBRACE)) {
            return parseLiteralValue(null);
        }
        return parseExpr();
    }

    private static boolean isTypeName(Expr x) {
        if (x instanceof Ident) {
            return true;
        }
        if (x instanceof SelectorExpr sel) {
            return sel.x() instanceof Ident;
        }
        if (x instanceof IndexExpr index) {
            return isTypeName(index.x());
        }
        if (x instanceof IndexListExpr index) {
            return isTypeName(index.x());
        }
        return false;
    }

    private static boolean isLiteralType(Expr x) {
        return isTypeName(x)
            || x instanceof ArrayType
            || x instanceof StructType
            || x instanceof MapType;
    }

    private static BasicLit.LitKind litKind(TokenType type) {
        return switch (type) {
            case INT -> BasicLit.LitKind.INT;
            case FLOAT -> BasicLit.LitKind.FLOAT;
            case IMAG -> BasicLit.LitKind.IMAG;
            case CHAR -> BasicLit.LitKind.CHAR;
            default -> BasicLit.LitKind.STRING;
        };
    }

    private Ident parseIdent() {
        Token token = expect(TokenType.IDENT, "identifier");
        return new Ident(token.lexeme());
    }

    private List<Ident> parseIdentList() {
        List<Ident> idents = new ArrayList<>();
        idents.add(parseIdent());
        while (match(TokenType.COMMA)) {
            idents.add(parseIdent());
        }
        return idents;
    }

    // ========================================================================
    // Statements
    // ========================================================================

    private BlockStmt parseFuncBody() {
        int savedExprLev = exprLev;
        exprLev = 0;
        try {
            return parseBlockStmt();
        } finally {
            exprLev = savedExprLev;
        }
    }

    private BlockStmt parseBlockStmt() {
        expect(TokenType.LBRACE, "'{'");
        List<Stmt> list = parseStmtList();
        expect(TokenType.RBRACE, "'}'");
        return new BlockStmt(list);
    }

    private List<Stmt> parseStmtList() {
        List<Stmt> list = new ArrayList<>();
        while (!check(TokenType.CASE) && !check(TokenType.DEFAULT)
            && !check(TokenType.RBRACE) && !check(TokenType.EOF)) {
            list.add(parseStmt());
        }
        return list;
    }

    private Stmt parseStmt() {
        Token token = peek();
        return switch (token.type()) {
            case CONST -> new DeclStmt(parseGenDecl(GenDecl.Keyword.CONST));
            case TYPE -> new DeclStmt(parseGenDecl(GenDecl.Keyword.TYPE));
            case VAR -> new DeclStmt(parseGenDecl(GenDecl.Keyword.VAR));

            case IDENT, INT, FLOAT, IMAG, CHAR, STRING, FUNC, LPAREN,
                 LBRACK, STRUCT, MAP, CHAN, INTERFACE,
                 ADD, SUB, MUL, AND, XOR, ARROW, NOT, TILDE -> {
                Stmt stmt = parseSimpleStmt(LABEL_OK);
                // A labeled statement already consumed the semicolon of its body
                if (!(stmt instanceof LabeledStmt)) {
                    expectSemi();
                }
                yield stmt;
            }

            case GO -> new GoStmt(parseCallStmt("go"));
            case DEFER -> new DeferStmt(parseCallStmt("defer"));
            case RETURN -> parseReturnStmt();
            case BREAK, CONTINUE, GOTO, FALLTHROUGH -> parseBranchStmt();
            case LBRACE -> {
                BlockStmt block = parseBlockStmt();
                expectSemi();
                yield block;
            }
            case IF -> parseIfStmt();
            case SWITCH -> parseSwitchStmt();
            case SELECT -> parseSelectStmt();
            case FOR -> parseForStmt();
            case SEMICOLON -> {
                advance();
                yield new EmptyStmt(token.isImplicitSemicolon());
            }
            // A semicolon may be omitted before a closing "}"
            case RBRACE -> new EmptyStmt(true);
            default -> throw new UnexpectedTokenException(token, "statement");
        };
    }

    private Stmt parseSimpleStmt(int mode) {
        List<Expr> lhs = parseExprList();
        Token token = peek();

        if (token.type().isAssignOp()) {
            advance();
            if (mode == RANGE_OK && check(TokenType.RANGE)
                && (token.type() == TokenType.DEFINE || token.type() == TokenType.ASSIGN)) {
                // Unpacked into a RangeStmt by parseForStmt
                Token range = advance();
                return new AssignStmt(lhs, token.lexeme(), List.of(new UnaryExpr(range.lexeme(), parseExpr())));
            }
            return new AssignStmt(lhs, token.lexeme(), parseExprList());
        }

        if (lhs.size() > 1) {
            throw new UnexpectedTokenException(token, "1 expression");
        }
        Expr x = lhs.get(0);

        switch (token.type()) {
            case COLON -> {
                if (mode == LABEL_OK && x instanceof Ident label) {
                    advance();
                    return new LabeledStmt(label, parseStmt());
                }
            }
            case ARROW -> {
                advance();
                return new SendStmt(x, parseExpr());
            }
            case INC, DEC -> {
                advance();
                return new IncDecStmt(x, token.lexeme());
            }
            default -> {
                // expression statement
            }
        }
        return new ExprStmt(x);
    }

    private CallExpr parseCallStmt(String keyword) {
        Token start = advance();
        Expr call = parseExpr();
        if (!(call instanceof CallExpr callExpr)) {
            throw new ExpectedTokenException("function must be invoked in " + keyword + " statement", start);
        }
        expectSemi();
        return callExpr;
    }

    private ReturnStmt parseReturnStmt() {
        expect(TokenType.RETURN, "'return'");
        List<Expr> results = List.of();
        if (!check(TokenType.SEMICOLON) && !check(TokenType.RBRACE)) {
            results = parseExprList();
        }
        expectSemi();
        return new ReturnStmt(results);
    }

    private BranchStmt parseBranchStmt() {
        Token keyword = advance();
        Ident label = null;
        if (keyword.type() != TokenType.FALLTHROUGH && check(TokenType.IDENT)) {
            label = parseIdent();
        }
        expectSemi();
        return new BranchStmt(keyword.lexeme(), label);
    }

    private IfStmt parseIfStmt() {
        Token ifToken = expect(TokenType.IF, "'if'");
        int outer = exprLev;
        exprLev = -1;
        if (check(TokenType.LBRACE)) {
            throw new ExpectedTokenException("missing condition in if statement", ifToken);
        }
        Stmt init = null;
        Expr cond;
        if (!check(TokenType.SEMICOLON)) {
            init = parseSimpleStmt(BASIC);
        }
        if (match(TokenType.SEMICOLON)) {
            if (check(TokenType.LBRACE)) {
                throw new ExpectedTokenException("missing condition in if statement", ifToken);
            }
            cond = toCondition(parseSimpleStmt(BASIC), ifToken, "if statement");
        } else {
            cond = toCondition(init, ifToken, "if statement");
            init = null;
        }
        exprLev = outer;

        BlockStmt body = parseBlockStmt();
        Stmt els = null;
        if (match(TokenType.ELSE)) {
            if (check(TokenType.IF)) {
                els = parseIfStmt();
            } else if (check(TokenType.LBRACE)) {
                els = parseBlockStmt();
                expectSemi();
            } else {
                throw new UnexpectedTokenException(peek(), "if statement or block");
            }
        } else {
            expectSemi();
        }
        return new IfStmt(init, cond, body, els);
    }

    private Stmt parseSwitchStmt() {
        Token switchToken = expect(TokenType.SWITCH, "'switch'");
        int outer = exprLev;
        exprLev = -1;
        Stmt init = null;
        Stmt tag = null;
        if (!check(TokenType.LBRACE)) {
            if (!check(TokenType.SEMICOLON)) {
                tag = parseSimpleStmt(BASIC);
            }
            if (match(TokenType.SEMICOLON)) {
                init = tag;
                tag = null;
                if (!check(TokenType.LBRACE)) {
                    tag = parseSimpleStmt(BASIC);
                }
            }
        }
        exprLev = outer;

        boolean typeSwitch = isTypeSwitchGuard(tag);
        expect(TokenType.LBRACE, "'{'");
        List<Stmt> clauses = new ArrayList<>();
        while (check(TokenType.CASE) || check(TokenType.DEFAULT)) {
            clauses.add(parseCaseClause());
        }
        expect(TokenType.RBRACE, "'}'");
        expectSemi();

        BlockStmt body = new BlockStmt(clauses);
        if (typeSwitch) {
            return new TypeSwitchStmt(init, tag, body);
        }
        Expr tagExpr = tag == null ? null : toCondition(tag, switchToken, "switch expression");
        return new SwitchStmt(init, tagExpr, body);
    }

    private static boolean isTypeSwitchGuard(Stmt stmt) {
        if (stmt instanceof ExprStmt exprStmt) {
            return isTypeSwitchAssert(exprStmt.x());
        }
        if (stmt instanceof AssignStmt assign) {
            return assign.op().equals(":=")
                && assign.lhs().size() == 1
                && assign.rhs().size() == 1
                && isTypeSwitchAssert(assign.rhs().get(0));
        }
        return false;
    }

    private static boolean isTypeSwitchAssert(Expr x) {
        return x instanceof TypeAssertExpr assertion && assertion.type() == null;
    }

    private CaseClause parseCaseClause() {
        List<Expr> list = List.of();
        if (match(TokenType.CASE)) {
            list = parseExprList();
        } else {
            expect(TokenType.DEFAULT, "'default'");
        }
        expect(TokenType.COLON, "':'");
        return new CaseClause(list, parseStmtList());
    }

    private SelectStmt parseSelectStmt() {
        expect(TokenType.SELECT, "'select'");
        expect(TokenType.LBRACE, "'{'");
        List<Stmt> clauses = new ArrayList<>();
        while (check(TokenType.CASE) || check(TokenType.DEFAULT)) {
            clauses.add(parseCommClause());
        }
        expect(TokenType.RBRACE, "'}'");
        expectSemi();
        return new SelectStmt(new BlockStmt(clauses));
    }

    private CommClause parseCommClause() {
        Stmt comm = null;
        if (match(TokenType.CASE)) {
            List<Expr> lhs = parseExprList();
            Token token = peek();
            if (token.type() == TokenType.ARROW) {
                if (lhs.size() > 1) {
                    throw new UnexpectedTokenException(token, "1 expression");
                }
                advance();
                comm = new SendStmt(lhs.get(0), parseExpr());
            } else if (token.type() == TokenType.ASSIGN || token.type() == TokenType.DEFINE) {
                if (lhs.size() > 2) {
                    throw new ExpectedTokenException("expected at most 2 expressions", token);
                }
                advance();
                comm = new AssignStmt(lhs, token.lexeme(), List.of(parseExpr()));
            } else {
                if (lhs.size() > 1) {
                    throw new UnexpectedTokenException(token, "1 expression");
                }
                comm = new ExprStmt(lhs.get(0));
            }
        } else {
            expect(TokenType.DEFAULT, "'default'");
        }
        expect(TokenType.COLON, "':'");
        return new CommClause(comm, parseStmtList());
    }

    private Stmt parseForStmt() {
        Token forToken = expect(TokenType.FOR, "'for'");
        int outer = exprLev;
        exprLev = -1;
        Stmt init = null;
        Stmt cond = null;
        Stmt post = null;
        boolean isRange = false;
        if (!check(TokenType.LBRACE)) {
            if (!check(TokenType.SEMICOLON)) {
                if (check(TokenType.RANGE)) {
                    // for range x
                    Token range = advance();
                    cond = new AssignStmt(List.of(), null, List.of(new UnaryExpr(range.lexeme(), parseExpr())));
                    isRange = true;
                } else {
                    cond = parseSimpleStmt(RANGE_OK);
                    isRange = isRangeClause(cond);
                }
            }
            if (!isRange && match(TokenType.SEMICOLON)) {
                init = cond;
                cond = null;
                if (!check(TokenType.SEMICOLON)) {
                    cond = parseSimpleStmt(BASIC);
                }
                expect(TokenType.SEMICOLON, "';'");
                if (!check(TokenType.LBRACE)) {
                    post = parseSimpleStmt(BASIC);
                }
            }
        }
        exprLev = outer;
        BlockStmt body = parseBlockStmt();
        expectSemi();

        if (isRange) {
            AssignStmt clause = (AssignStmt) cond;
            Expr x = ((UnaryExpr) clause.rhs().get(0)).x();
            Expr key = null;
            Expr value = null;
            switch (clause.lhs().size()) {
                case 0 -> { }
                case 1 -> key = clause.lhs().get(0);
                case 2 -> {
                    key = clause.lhs().get(0);
                    value = clause.lhs().get(1);
                }
                default -> throw new ExpectedTokenException("range clause permits at most two iteration variables", forToken);
            }
            return new RangeStmt(key, value, clause.op(), x, body);
        }
        Expr condExpr = cond == null ? null : toCondition(cond, forToken, "for loop");
        return new ForStmt(init, condExpr, post, body);
    }

    private static boolean isRangeClause(Stmt stmt) {
        return stmt instanceof AssignStmt assign
            && assign.rhs().size() == 1
            && assign.rhs().get(0) instanceof UnaryExpr unary
            && unary.op().equals("range");
    }

    private static Expr toCondition(Stmt stmt, Token at, String context) {
        if (stmt instanceof ExprStmt exprStmt) {
            return exprStmt.x();
        }
        throw new ExpectedTokenException("cannot use " + describe(stmt) + " as value in " + context, at);
    }

    private static String describe(Stmt stmt) {
        if (stmt == null) {
            return "empty statement";
        }
        return stmt.kind().tag().replace('-', ' ');
    }

    // ========================================================================
    // Comments
    // ========================================================================

    /**
     * The comment group directly above the current token, if any.
     */
    private CommentGroup leadComment() {
        Lexer.CommentBlock block = leadComments.get(current);
        if (block != null && block.endLine() == peek().line() - 1) {
            return block.group();
        }
        return null;
    }

    /**
     * The comment group following the previous token on the same line, if any.
     */
    private CommentGroup lineComment() {
        Lexer.CommentBlock block = lineComments.get(current - 1);
        return block != null ? block.group() : null;
    }

    // ========================================================================
    // Token helpers
    // ========================================================================

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private boolean checkAhead(int offset, TokenType type) {
        int pos = current + offset;
        if (pos >= tokens.size()) return false;
        return tokens.get(pos).type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return current >= tokens.size() - 1;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }

    private Token expect(TokenType type, String expected) {
        if (check(type)) {
            return advance();
        }
        throw new UnexpectedTokenException(peek(), expected);
    }

    private void expectSemi() {
        // Semicolons may be omitted before a closing ")" or "}"
        if (check(TokenType.RPAREN) || check(TokenType.RBRACE) || check(TokenType.EOF)) {
            return;
        }
        if (!match(TokenType.SEMICOLON)) {
            throw new UnexpectedTokenException(peek(), "';' or newline");
        }
    }
}
