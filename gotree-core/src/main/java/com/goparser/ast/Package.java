package com.goparser.ast;

import java.util.Map;

/**
 * A set of files sharing a package clause.
 *
 * <p>Part of the grammar model but not of the generic tree schema: a generic tree
 * always describes exactly one file.</p>
 */
public record Package(
    String name,
    Map<String, File> files
) implements Node {
    @Override
    public NodeKind kind() {
        return NodeKind.PACKAGE;
    }
}
