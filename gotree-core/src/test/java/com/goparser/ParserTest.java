package com.goparser;

import com.goparser.ast.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ParserTest {

    private static FuncDecl onlyFunc(File file) {
        return (FuncDecl) file.decls().get(file.decls().size() - 1);
    }

    @Test
    void parsesPackageClauseAndImportGroup() {
        String source = """
            // Package demo does things.
            package demo

            import (
            	"fmt"
            	str "strings"
            	. "math"
            )
            """;
        File file = Parser.parse(source);

        assertEquals("demo", file.name().name());
        assertNotNull(file.doc());
        assertEquals("// Package demo does things.", file.doc().list().get(0).text());
        assertEquals(1, file.decls().size());

        GenDecl imports = (GenDecl) file.decls().get(0);
        assertEquals(GenDecl.Keyword.IMPORT, imports.keyword());
        assertEquals(NodeKind.IMPORT_GROUP, imports.kind());
        assertTrue(imports.parenthesized());
        assertEquals(3, imports.specs().size());

        ImportSpec fmt = (ImportSpec) imports.specs().get(0);
        assertNull(fmt.name());
        assertEquals("\"fmt\"", fmt.path().value());
        assertEquals("str", ((ImportSpec) imports.specs().get(1)).name().name());
        assertEquals(".", ((ImportSpec) imports.specs().get(2)).name().name());
    }

    @Test
    void parsesMethodWithGenericReceiverAndNamedResults() {
        String source = """
            package p

            func (s *Stack[T]) Push(v T) (n int, err error) {
            	s.items = append(s.items, v)
            	return len(s.items), nil
            }
            """;
        FuncDecl push = onlyFunc(Parser.parse(source));

        assertEquals("Push", push.name().name());
        Field recv = push.recv().list().get(0);
        assertEquals("s", recv.names().get(0).name());
        StarExpr star = assertInstanceOf(StarExpr.class, recv.type());
        IndexExpr instance = assertInstanceOf(IndexExpr.class, star.x());
        assertEquals(new Ident("Stack"), instance.x());

        assertEquals(1, push.type().params().list().size());
        assertEquals(2, push.type().results().list().size());
        assertEquals("err", push.type().results().list().get(1).names().get(0).name());

        List<Stmt> body = push.body().list();
        assertEquals(2, body.size());
        AssignStmt assign = assertInstanceOf(AssignStmt.class, body.get(0));
        assertEquals("=", assign.op());
        assertInstanceOf(CallExpr.class, assign.rhs().get(0));
        ReturnStmt ret = assertInstanceOf(ReturnStmt.class, body.get(1));
        assertEquals(2, ret.results().size());
    }

    @Test
    void groupsParameterNamesSharingAType() {
        FuncDecl f = onlyFunc(Parser.parse("package p\nfunc f(a, b int, c ...string) {}\n"));
        List<Field> params = f.type().params().list();
        assertEquals(2, params.size());
        assertEquals(List.of(new Ident("a"), new Ident("b")), params.get(0).names());
        assertEquals(new Ident("int"), params.get(0).type());
        Ellipsis variadic = assertInstanceOf(Ellipsis.class, params.get(1).type());
        assertEquals(new Ident("string"), variadic.elt());
        assertNull(f.type().results());
    }

    @Test
    void unnamedParametersAreTypes() {
        FuncDecl f = onlyFunc(Parser.parse("package p\nfunc f(int, []byte, pkg.T) bool\n"));
        List<Field> params = f.type().params().list();
        assertEquals(3, params.size());
        params.forEach(p -> assertTrue(p.names().isEmpty()));
        assertInstanceOf(SelectorExpr.class, params.get(2).type());
        assertNull(f.body());
        assertEquals(new Ident("bool"), f.type().results().list().get(0).type());
    }

    @Test
    @DisplayName("Type parameters, array types, interfaces with type sets and aliases")
    void parsesTypeDeclarations() {
        String source = """
            package p

            type List[T any] struct {
            	items []T
            }

            type Buf [16]byte

            type Num interface {
            	~int | ~float64
            	String() string
            }

            type Alias = map[string][]int
            """;
        File file = Parser.parse(source);
        assertEquals(4, file.decls().size());

        TypeSpec list = (TypeSpec) ((GenDecl) file.decls().get(0)).specs().get(0);
        assertEquals("List", list.name().name());
        assertNotNull(list.typeParams());
        assertEquals(new Ident("any"), list.typeParams().list().get(0).type());
        StructType struct = assertInstanceOf(StructType.class, list.type());
        Field items = struct.fields().list().get(0);
        assertEquals("items", items.names().get(0).name());
        assertEquals(new ArrayType(null, new Ident("T")), items.type());

        TypeSpec buf = (TypeSpec) ((GenDecl) file.decls().get(1)).specs().get(0);
        assertNull(buf.typeParams());
        ArrayType array = assertInstanceOf(ArrayType.class, buf.type());
        assertEquals("16", ((BasicLit) array.len()).value());

        TypeSpec num = (TypeSpec) ((GenDecl) file.decls().get(2)).specs().get(0);
        InterfaceType iface = assertInstanceOf(InterfaceType.class, num.type());
        List<Field> elements = iface.methods().list();
        assertEquals(2, elements.size());
        BinaryExpr union = assertInstanceOf(BinaryExpr.class, elements.get(0).type());
        assertEquals("|", union.op());
        assertEquals(new UnaryExpr("~", new Ident("int")), union.x());
        assertEquals("String", elements.get(1).names().get(0).name());
        assertInstanceOf(FuncType.class, elements.get(1).type());

        TypeSpec alias = (TypeSpec) ((GenDecl) file.decls().get(3)).specs().get(0);
        assertTrue(alias.alias());
        MapType map = assertInstanceOf(MapType.class, alias.type());
        assertEquals(new ArrayType(null, new Ident("int")), map.value());
    }

    @Test
    @DisplayName("A bracket after a type name is an array length unless it can only start type parameters")
    void distinguishesArrayLengthFromTypeParameters() {
        String source = """
            package p

            type U [N * 2]int

            type B [len(a)]int

            type T[P *C] struct{}

            type G[P *C,] struct{}

            type M[K comparable, V any] map[K]V
            """;
        File file = Parser.parse(source);
        assertEquals(5, file.decls().size());

        TypeSpec u = (TypeSpec) ((GenDecl) file.decls().get(0)).specs().get(0);
        assertNull(u.typeParams());
        ArrayType scaled = assertInstanceOf(ArrayType.class, u.type());
        assertEquals(new BinaryExpr(new Ident("N"), "*", new BasicLit(BasicLit.LitKind.INT, "2")), scaled.len());
        assertEquals(new Ident("int"), scaled.elt());

        TypeSpec b = (TypeSpec) ((GenDecl) file.decls().get(1)).specs().get(0);
        assertNull(b.typeParams());
        ArrayType sized = assertInstanceOf(ArrayType.class, b.type());
        CallExpr len = assertInstanceOf(CallExpr.class, sized.len());
        assertEquals(new Ident("len"), len.fun());
        assertEquals(List.of(new Ident("a")), len.args());

        TypeSpec t = (TypeSpec) ((GenDecl) file.decls().get(2)).specs().get(0);
        assertNull(t.typeParams());
        ArrayType product = assertInstanceOf(ArrayType.class, t.type());
        assertEquals(new BinaryExpr(new Ident("P"), "*", new Ident("C")), product.len());
        assertInstanceOf(StructType.class, product.elt());

        // A trailing comma forces a type parameter list
        TypeSpec g = (TypeSpec) ((GenDecl) file.decls().get(3)).specs().get(0);
        assertNotNull(g.typeParams());
        Field param = g.typeParams().list().get(0);
        assertEquals(List.of(new Ident("P")), param.names());
        assertEquals(new StarExpr(new Ident("C")), param.type());
        assertInstanceOf(StructType.class, g.type());

        TypeSpec m = (TypeSpec) ((GenDecl) file.decls().get(4)).specs().get(0);
        List<Field> params = m.typeParams().list();
        assertEquals(2, params.size());
        assertEquals(new Ident("comparable"), params.get(0).type());
        assertEquals(new Ident("any"), params.get(1).type());
        assertInstanceOf(MapType.class, m.type());
    }

    @Test
    void parsesControlFlowStatements() {
        String source = """
            package p

            func f(ch chan int, m map[string]int, xs ...int) {
            	for i := 0; i < 10; i++ {
            		if v, ok := m["k"]; ok && v > i {
            			continue
            		} else if i == 3 {
            			break
            		} else {
            			ch <- i
            		}
            	}
            	for k, v := range m {
            		_ = k + v
            	}
            	for range xs {
            	}
            	switch x := len(xs); {
            	case x > 1, x < -1:
            		fallthrough
            	default:
            	}
            	var y interface{} = 1
            	switch t := y.(type) {
            	case int:
            		_ = t
            	case string, nil:
            	}
            	select {
            	case v := <-ch:
            		_ = v
            	case ch <- 1:
            	default:
            	}
            	go func() { defer close(ch) }()
            outer:
            	for {
            		break outer
            	}
            }
            """;
        List<Stmt> body = onlyFunc(Parser.parse(source)).body().list();
        assertEquals(9, body.size());

        ForStmt loop = assertInstanceOf(ForStmt.class, body.get(0));
        assertInstanceOf(AssignStmt.class, loop.init());
        assertInstanceOf(BinaryExpr.class, loop.cond());
        assertInstanceOf(IncDecStmt.class, loop.post());
        IfStmt ifStmt = assertInstanceOf(IfStmt.class, loop.body().list().get(0));
        assertInstanceOf(AssignStmt.class, ifStmt.init());
        assertEquals("&&", ((BinaryExpr) ifStmt.cond()).op());
        IfStmt elseIf = assertInstanceOf(IfStmt.class, ifStmt.els());
        BlockStmt elseBlock = assertInstanceOf(BlockStmt.class, elseIf.els());
        assertInstanceOf(SendStmt.class, elseBlock.list().get(0));

        RangeStmt range = assertInstanceOf(RangeStmt.class, body.get(1));
        assertEquals(new Ident("k"), range.key());
        assertEquals(new Ident("v"), range.value());
        assertEquals(":=", range.op());
        assertEquals(new Ident("m"), range.x());

        RangeStmt bareRange = assertInstanceOf(RangeStmt.class, body.get(2));
        assertNull(bareRange.key());
        assertNull(bareRange.op());

        SwitchStmt sw = assertInstanceOf(SwitchStmt.class, body.get(3));
        assertNotNull(sw.init());
        assertNull(sw.tag());
        CaseClause first = (CaseClause) sw.body().list().get(0);
        assertEquals(2, first.list().size());
        assertEquals(new BranchStmt("fallthrough", null), first.body().get(0));
        assertTrue(((CaseClause) sw.body().list().get(1)).isDefault());

        assertInstanceOf(DeclStmt.class, body.get(4));

        TypeSwitchStmt typeSwitch = assertInstanceOf(TypeSwitchStmt.class, body.get(5));
        AssignStmt guard = assertInstanceOf(AssignStmt.class, typeSwitch.assign());
        TypeAssertExpr assertion = assertInstanceOf(TypeAssertExpr.class, guard.rhs().get(0));
        assertNull(assertion.type());
        assertEquals(2, typeSwitch.body().list().size());

        SelectStmt select = assertInstanceOf(SelectStmt.class, body.get(6));
        List<Stmt> clauses = select.body().list();
        assertEquals(3, clauses.size());
        AssignStmt recv = assertInstanceOf(AssignStmt.class, ((CommClause) clauses.get(0)).comm());
        assertEquals(new UnaryExpr("<-", new Ident("ch")), recv.rhs().get(0));
        assertInstanceOf(SendStmt.class, ((CommClause) clauses.get(1)).comm());
        assertNull(((CommClause) clauses.get(2)).comm());

        GoStmt go = assertInstanceOf(GoStmt.class, body.get(7));
        FuncLit lit = assertInstanceOf(FuncLit.class, go.call().fun());
        assertInstanceOf(DeferStmt.class, lit.body().list().get(0));

        LabeledStmt labeled = assertInstanceOf(LabeledStmt.class, body.get(8));
        assertEquals("outer", labeled.label().name());
        ForStmt forever = assertInstanceOf(ForStmt.class, labeled.stmt());
        assertNull(forever.cond());
        assertEquals(new BranchStmt("break", new Ident("outer")), forever.body().list().get(0));
    }

    @Test
    void parsesExpressions() {
        String source = """
            package p

            var (
            	a = []int{1, 2, 3}[1:2:3]
            	b = map[string]Point{"o": {X: 1, Y: 2}}
            	c = &Point{X: 1}
            	d = f[int, string](x...)
            	e = x.(fmt.Stringer).String()
            	g = -x * (y + z) << 2
            	h = <-ch
            	k = s[1:]
            )
            """;
        GenDecl vars = (GenDecl) Parser.parse(source).decls().get(0);
        assertEquals(8, vars.specs().size());
        List<Expr> values = vars.specs().stream().map(s -> ((ValueSpec) s).values().get(0)).toList();

        SliceExpr a = assertInstanceOf(SliceExpr.class, values.get(0));
        assertTrue(a.slice3());
        assertEquals("3", ((BasicLit) a.max()).value());
        CompositeLit ints = assertInstanceOf(CompositeLit.class, a.x());
        assertEquals(3, ints.elts().size());

        CompositeLit b = assertInstanceOf(CompositeLit.class, values.get(1));
        KeyValueExpr entry = assertInstanceOf(KeyValueExpr.class, b.elts().get(0));
        CompositeLit point = assertInstanceOf(CompositeLit.class, entry.value());
        assertNull(point.type());
        assertEquals(2, point.elts().size());

        UnaryExpr c = assertInstanceOf(UnaryExpr.class, values.get(2));
        assertEquals("&", c.op());
        assertInstanceOf(CompositeLit.class, c.x());

        CallExpr d = assertInstanceOf(CallExpr.class, values.get(3));
        assertTrue(d.hasEllipsis());
        IndexListExpr generic = assertInstanceOf(IndexListExpr.class, d.fun());
        assertEquals(List.of(new Ident("int"), new Ident("string")), generic.indices());

        CallExpr e = assertInstanceOf(CallExpr.class, values.get(4));
        SelectorExpr method = assertInstanceOf(SelectorExpr.class, e.fun());
        TypeAssertExpr assertion = assertInstanceOf(TypeAssertExpr.class, method.x());
        assertEquals(new SelectorExpr(new Ident("fmt"), new Ident("Stringer")), assertion.type());

        BinaryExpr g = assertInstanceOf(BinaryExpr.class, values.get(5));
        assertEquals("<<", g.op());
        BinaryExpr product = assertInstanceOf(BinaryExpr.class, g.x());
        assertEquals("*", product.op());
        assertEquals(new UnaryExpr("-", new Ident("x")), product.x());
        assertInstanceOf(ParenExpr.class, product.y());

        assertEquals(new UnaryExpr("<-", new Ident("ch")), values.get(6));

        SliceExpr k = assertInstanceOf(SliceExpr.class, values.get(7));
        assertNull(k.high());
        assertFalse(k.slice3());
    }

    @Test
    @DisplayName("Doc comments attach to declarations, specs and fields; line comments to specs and fields")
    void attachesComments() {
        String source = """
            package p

            // Point is a point.
            type Point struct {
            	// X coordinate.
            	X int // east
            	Y int
            }

            const (
            	// A is first.
            	A = iota // zero
            	B
            )
            """;
        File file = Parser.parse(source);

        GenDecl type = (GenDecl) file.decls().get(0);
        assertEquals("// Point is a point.", type.doc().list().get(0).text());
        TypeSpec point = (TypeSpec) type.specs().get(0);
        assertNull(point.doc());

        List<Field> fields = ((StructType) point.type()).fields().list();
        assertEquals("// X coordinate.", fields.get(0).doc().list().get(0).text());
        assertEquals("// east", fields.get(0).comment().list().get(0).text());
        assertNull(fields.get(1).doc());
        assertNull(fields.get(1).comment());

        GenDecl consts = (GenDecl) file.decls().get(1);
        assertNull(consts.doc());
        ValueSpec a = (ValueSpec) consts.specs().get(0);
        assertEquals("// A is first.", a.doc().list().get(0).text());
        assertEquals("// zero", a.comment().list().get(0).text());
        ValueSpec b = (ValueSpec) consts.specs().get(1);
        assertTrue(b.values().isEmpty());
        assertNull(b.doc());

        assertEquals(4, file.comments().size());
    }

    @Test
    void compositeLiteralIsNotParsedInControlClause() {
        FuncDecl f = onlyFunc(Parser.parse("package p\nfunc f() {\n\tif x == y {\n\t}\n\tfor _, v := range []T{a} {\n\t}\n}\n"));
        IfStmt ifStmt = (IfStmt) f.body().list().get(0);
        assertEquals(new BinaryExpr(new Ident("x"), "==", new Ident("y")), ifStmt.cond());
        RangeStmt range = (RangeStmt) f.body().list().get(1);
        assertInstanceOf(CompositeLit.class, range.x());
    }

    @Test
    void reportsPositionOfUnexpectedToken() {
        String source = "package p\n\nfunc f() {\n\tx := \n}\n";
        UnexpectedTokenException e = assertThrows(UnexpectedTokenException.class, () -> Parser.parse(source));
        assertEquals(5, e.line());
        assertEquals(1, e.column());
        assertEquals("5:1: expected expression, found '}'", e.getMessage());
    }

    @Test
    void rejectsMissingPackageClause() {
        assertThrows(UnexpectedTokenException.class, () -> Parser.parse("func f() {}\n"));
    }

    @Test
    void rejectsUnclosedBlock() {
        ParseException e = assertThrows(ParseException.class, () -> Parser.parse("package p\nfunc f() {"));
        assertTrue(e.getMessage().endsWith("found EOF"), e.getMessage());
    }

    @Test
    void rejectsImportAfterDeclarations() {
        ParseException e = assertThrows(ParseException.class,
            () -> Parser.parse("package p\nimport \"fmt\"\nvar x = 1\nimport \"os\"\n"));
        assertTrue(e.getMessage().contains("imports must appear before other declarations"));
    }

    @Test
    void rejectsVarWithoutTypeOrValue() {
        ParseException e = assertThrows(ParseException.class, () -> Parser.parse("package p\nvar x\n"));
        assertTrue(e.getMessage().contains("missing variable type or initialization"));
    }

    @Test
    void rejectsGoWithoutCall() {
        ParseException e = assertThrows(ParseException.class, () -> Parser.parse("package p\nfunc f() { go f }\n"));
        assertTrue(e.getMessage().contains("function must be invoked in go statement"));
    }
}
