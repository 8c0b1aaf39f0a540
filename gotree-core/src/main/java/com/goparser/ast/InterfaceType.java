package com.goparser.ast;

public record InterfaceType(FieldList methods) implements Expr {
    @Override
    public NodeKind kind() {
        return NodeKind.INTERFACE_TYPE;
    }
}
