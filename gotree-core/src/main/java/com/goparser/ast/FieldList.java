package com.goparser.ast;

import java.util.List;

public record FieldList(List<Field> list) implements Node {
    @Override
    public NodeKind kind() {
        return NodeKind.FIELD_LIST;
    }
}
