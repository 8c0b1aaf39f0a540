package com.goparser.ast;

/**
 * Concrete grammar category of a syntax node.
 *
 * <p>The tag is the {@code type} string written for the node in the generic tree.</p>
 */
public enum NodeKind {
    // Leaves
    IDENT("ident"),
    BASIC_LIT("basic-lit"),

    // Declarations
    FUNC_DECL("func-decl"),
    IMPORT_GROUP("import-group"),
    CONST_GROUP("const-group"),
    TYPE_GROUP("type-group"),
    VAR_GROUP("var-group"),
    BAD_DECL("bad-decl"),

    // Specs
    IMPORT_SPEC("import-spec"),
    VALUE_SPEC("value-spec"),
    TYPE_SPEC("type-spec"),

    // Expressions
    CALL_EXPR("call-expr"),
    SELECTOR_EXPR("selector-expr"),
    INDEX_EXPR("index-expr"),
    INDEX_LIST_EXPR("index-list-expr"),
    SLICE_EXPR("slice-expr"),
    BINARY_EXPR("binary-expr"),
    UNARY_EXPR("unary-expr"),
    STAR_EXPR("star-expr"),
    COMPOSITE_LIT("composite-lit"),
    TYPE_ASSERT_EXPR("type-assert-expr"),
    PAREN_EXPR("paren-expr"),
    FUNC_LIT("func-lit"),
    KEY_VALUE_EXPR("key-value-expr"),
    ELLIPSIS("ellipsis"),
    BAD_EXPR("bad-expr"),

    // Statements
    IF_STMT("if-stmt"),
    FOR_STMT("for-stmt"),
    RANGE_STMT("range-stmt"),
    SWITCH_STMT("switch-stmt"),
    TYPE_SWITCH_STMT("type-switch-stmt"),
    SELECT_STMT("select-stmt"),
    CASE_CLAUSE("case-clause"),
    COMM_CLAUSE("comm-clause"),
    LABELED_STMT("labeled-stmt"),
    BRANCH_STMT("branch-stmt"),
    SEND_STMT("send-stmt"),
    INC_DEC_STMT("inc-dec-stmt"),
    GO_STMT("go-stmt"),
    DEFER_STMT("defer-stmt"),
    RETURN_STMT("return-stmt"),
    ASSIGN_STMT("assign-stmt"),
    EXPR_STMT("expr-stmt"),
    DECL_STMT("decl-stmt"),
    BLOCK_STMT("block-stmt"),
    EMPTY_STMT("empty-stmt"),
    BAD_STMT("bad-stmt"),

    // Type expressions
    STRUCT_TYPE("struct-type"),
    INTERFACE_TYPE("interface-type"),
    FUNC_TYPE("func-type"),
    ARRAY_TYPE("array-type"),
    MAP_TYPE("map-type"),
    CHAN_TYPE("chan-type"),

    // Structural lists
    FIELD("field"),
    FIELD_LIST("field-list"),

    // Comments
    COMMENT("comment"),
    COMMENT_GROUP("comment-group"),

    // Source units
    FILE("file"),
    PACKAGE("package");

    private final String tag;

    NodeKind(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
