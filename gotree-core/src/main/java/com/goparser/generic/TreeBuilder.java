package com.goparser.generic;

import com.goparser.ast.Comment;
import com.goparser.ast.CommentGroup;
import com.goparser.ast.Node;
import com.goparser.ast.NodeKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Assembles one {@link GenericNode}.
 *
 * <p>The dispatcher records the syntax children in output order; their converted
 * forms are appended later, and {@link #build()} is called once all of them are done.</p>
 */
public final class TreeBuilder {
    private final String type;
    private String name;
    private String value;
    private final List<String> comments = new ArrayList<>();
    private final List<Node> pending = new ArrayList<>();
    private final List<GenericNode> children = new ArrayList<>();

    public TreeBuilder(NodeKind kind) {
        this.type = kind.tag();
    }

    public TreeBuilder name(String name) {
        this.name = name;
        return this;
    }

    public TreeBuilder value(String value) {
        this.value = value;
        return this;
    }

    /**
     * Schedules a child; null is ignored.
     */
    public TreeBuilder child(Node node) {
        if (node != null) {
            pending.add(node);
        }
        return this;
    }

    public TreeBuilder children(List<? extends Node> nodes) {
        if (nodes != null) {
            for (Node node : nodes) {
                child(node);
            }
        }
        return this;
    }

    /**
     * Appends the text of every comment of the given groups, skipping null groups.
     */
    public TreeBuilder comments(CommentGroup... groups) {
        for (CommentGroup group : groups) {
            if (group == null) continue;
            for (Comment comment : group.list()) {
                comments.add(comment.text());
            }
        }
        return this;
    }

    public TreeBuilder comment(String text) {
        comments.add(text);
        return this;
    }

    List<Node> pendingChildren() {
        return Collections.unmodifiableList(pending);
    }

    void append(GenericNode child) {
        children.add(child);
    }

    public GenericNode build() {
        return new GenericNode(type, name, value, children, comments);
    }
}
