package com.goparser.generic;

import com.goparser.ast.*;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Converts a Go syntax tree into a {@link GenericNode} tree.
 *
 * <p>Every node kind decides its own name, value, comments and the order of its
 * children. Each node is claimed in the {@link CycleGuard} when it is entered, before
 * its children are scheduled, so shared subtrees are emitted once (at their first
 * occurrence in depth-first order) and cycles terminate.</p>
 *
 * <p>The walk keeps its frames on an explicit stack, so the nesting depth of the
 * input is limited by the heap and not by the thread stack.</p>
 */
public final class NodeDispatcher {

    private NodeDispatcher() {
    }

    public static GenericNode classify(Node root) {
        return classify(root, new CycleGuard());
    }

    /**
     * Converts {@code root} using an existing guard.
     *
     * @return the generic tree, or null if the guard had already claimed {@code root}
     * @throws UnsupportedNodeKindException if a node of a kind outside the schema is reached
     */
    public static GenericNode classify(Node root, CycleGuard guard) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(guard, "guard");

        Deque<Frame> stack = new ArrayDeque<>();
        GenericNode[] result = new GenericNode[1];
        stack.push(new Enter(root, null));

        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            if (frame instanceof Enter enter) {
                if (!guard.claim(enter.node())) {
                    continue;
                }
                TreeBuilder builder = dispatch(enter.node());
                stack.push(new Exit(builder, enter.parent()));
                List<Node> children = builder.pendingChildren();
                for (int i = children.size() - 1; i >= 0; i--) {
                    stack.push(new Enter(children.get(i), builder));
                }
            } else if (frame instanceof Exit exit) {
                GenericNode built = exit.builder().build();
                if (exit.parent() != null) {
                    exit.parent().append(built);
                } else {
                    result[0] = built;
                }
            }
        }
        return result[0];
    }

    private sealed interface Frame permits Enter, Exit {}

    private record Enter(Node node, TreeBuilder parent) implements Frame {}

    private record Exit(TreeBuilder builder, TreeBuilder parent) implements Frame {}

    /**
     * Decides the name, value, comments and ordered children of one node.
     */
    static TreeBuilder dispatch(Node node) {
        TreeBuilder b = new TreeBuilder(node.kind());
        return switch (node.kind()) {
            // Leaves
            case IDENT -> b.value(((Ident) node).name());
            case BASIC_LIT -> b.value(((BasicLit) node).value());

            // Declarations
            case FUNC_DECL -> {
                FuncDecl decl = (FuncDecl) node;
                yield b.name(decl.name().name())
                    .comments(decl.doc())
                    .child(decl.recv())
                    .child(decl.type())
                    .child(decl.body());
            }
            case IMPORT_GROUP, CONST_GROUP, TYPE_GROUP, VAR_GROUP -> {
                GenDecl decl = (GenDecl) node;
                yield b.comments(decl.doc()).children(decl.specs());
            }
            case BAD_DECL, BAD_EXPR, BAD_STMT, EMPTY_STMT -> b;

            // Specs
            case IMPORT_SPEC -> {
                ImportSpec spec = (ImportSpec) node;
                yield b.comments(spec.doc(), spec.comment())
                    .child(spec.name())
                    .child(spec.path());
            }
            case VALUE_SPEC -> {
                ValueSpec spec = (ValueSpec) node;
                yield b.comments(spec.doc(), spec.comment())
                    .children(spec.names())
                    .child(spec.type())
                    .children(spec.values());
            }
            case TYPE_SPEC -> {
                TypeSpec spec = (TypeSpec) node;
                yield b.name(spec.name().name())
                    .comments(spec.doc(), spec.comment())
                    .child(spec.typeParams())
                    .child(spec.type());
            }

            // Expressions
            case CALL_EXPR -> {
                CallExpr call = (CallExpr) node;
                yield b.child(call.fun()).children(call.args());
            }
            case SELECTOR_EXPR -> {
                SelectorExpr sel = (SelectorExpr) node;
                yield b.child(sel.x()).child(sel.sel());
            }
            case INDEX_EXPR -> {
                IndexExpr index = (IndexExpr) node;
                yield b.child(index.x()).child(index.index());
            }
            case INDEX_LIST_EXPR -> {
                IndexListExpr index = (IndexListExpr) node;
                yield b.child(index.x()).children(index.indices());
            }
            case SLICE_EXPR -> {
                SliceExpr slice = (SliceExpr) node;
                yield b.child(slice.x()).child(slice.low()).child(slice.high()).child(slice.max());
            }
            case BINARY_EXPR -> {
                BinaryExpr binary = (BinaryExpr) node;
                yield b.child(binary.x()).child(binary.y());
            }
            case UNARY_EXPR -> b.child(((UnaryExpr) node).x());
            case STAR_EXPR -> b.child(((StarExpr) node).x());
            case PAREN_EXPR -> b.child(((ParenExpr) node).x());
            case COMPOSITE_LIT -> {
                CompositeLit lit = (CompositeLit) node;
                yield b.child(lit.type()).children(lit.elts());
            }
            case TYPE_ASSERT_EXPR -> {
                TypeAssertExpr assertion = (TypeAssertExpr) node;
                yield b.child(assertion.x()).child(assertion.type());
            }
            case FUNC_LIT -> {
                FuncLit lit = (FuncLit) node;
                yield b.child(lit.type()).child(lit.body());
            }
            case KEY_VALUE_EXPR -> {
                KeyValueExpr kv = (KeyValueExpr) node;
                yield b.child(kv.key()).child(kv.value());
            }
            case ELLIPSIS -> b.child(((Ellipsis) node).elt());

            // Statements
            case IF_STMT -> {
                IfStmt stmt = (IfStmt) node;
                yield b.child(stmt.init()).child(stmt.cond()).child(stmt.body()).child(stmt.els());
            }
            case FOR_STMT -> {
                ForStmt stmt = (ForStmt) node;
                yield b.child(stmt.init()).child(stmt.cond()).child(stmt.post()).child(stmt.body());
            }
            case RANGE_STMT -> {
                RangeStmt stmt = (RangeStmt) node;
                yield b.child(stmt.key()).child(stmt.value()).child(stmt.x()).child(stmt.body());
            }
            case SWITCH_STMT -> {
                SwitchStmt stmt = (SwitchStmt) node;
                yield b.child(stmt.init()).child(stmt.tag()).child(stmt.body());
            }
            case TYPE_SWITCH_STMT -> {
                TypeSwitchStmt stmt = (TypeSwitchStmt) node;
                yield b.child(stmt.init()).child(stmt.assign()).child(stmt.body());
            }
            case SELECT_STMT -> b.child(((SelectStmt) node).body());
            case CASE_CLAUSE -> {
                CaseClause clause = (CaseClause) node;
                yield b.children(clause.list()).children(clause.body());
            }
            case COMM_CLAUSE -> {
                CommClause clause = (CommClause) node;
                yield b.child(clause.comm()).children(clause.body());
            }
            case LABELED_STMT -> {
                LabeledStmt stmt = (LabeledStmt) node;
                yield b.child(stmt.label()).child(stmt.stmt());
            }
            case BRANCH_STMT -> b.child(((BranchStmt) node).label());
            case SEND_STMT -> {
                SendStmt stmt = (SendStmt) node;
                yield b.child(stmt.chan()).child(stmt.value());
            }
            case INC_DEC_STMT -> b.child(((IncDecStmt) node).x());
            case GO_STMT -> b.child(((GoStmt) node).call());
            case DEFER_STMT -> b.child(((DeferStmt) node).call());
            case RETURN_STMT -> b.children(((ReturnStmt) node).results());
            case ASSIGN_STMT -> {
                AssignStmt stmt = (AssignStmt) node;
                yield b.children(stmt.lhs()).children(stmt.rhs());
            }
            case EXPR_STMT -> b.child(((ExprStmt) node).x());
            case DECL_STMT -> b.child(((DeclStmt) node).decl());
            case BLOCK_STMT -> b.children(((BlockStmt) node).list());

            // Type expressions
            case STRUCT_TYPE -> b.child(((StructType) node).fields());
            case INTERFACE_TYPE -> b.child(((InterfaceType) node).methods());
            case FUNC_TYPE -> {
                FuncType type = (FuncType) node;
                yield b.child(type.typeParams()).child(type.params()).child(type.results());
            }
            case ARRAY_TYPE -> {
                ArrayType type = (ArrayType) node;
                yield b.child(type.len()).child(type.elt());
            }
            case MAP_TYPE -> {
                MapType type = (MapType) node;
                yield b.child(type.key()).child(type.value());
            }
            case CHAN_TYPE -> b.child(((ChanType) node).value());

            // Structural lists
            case FIELD -> {
                Field field = (Field) node;
                yield b.comments(field.doc(), field.comment())
                    .children(field.names())
                    .child(field.type())
                    .child(field.tag());
            }
            case FIELD_LIST -> b.children(((FieldList) node).list());

            // Comments
            case COMMENT -> b.comment(((Comment) node).text());
            case COMMENT_GROUP -> b.children(((CommentGroup) node).list());

            // Source units
            case FILE -> {
                File file = (File) node;
                yield b.value(file.name().name())
                    .comments(file.doc())
                    .children(file.decls());
            }
            case PACKAGE -> throw new UnsupportedNodeKindException(node.kind());
        };
    }
}
