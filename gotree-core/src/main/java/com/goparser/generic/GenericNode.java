package com.goparser.generic;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Language-independent tree node produced from a Go syntax node.
 *
 * <p>{@code type} is always set. {@code name} and {@code value} are present only for
 * the node kinds that carry them; {@code children} and {@code comments} are never
 * null and are empty when the kind has nothing to put there.</p>
 */
public record GenericNode(
    String type,
    String name,      // Can be null
    String value,     // Can be null
    List<GenericNode> children,
    List<String> comments
) {
    public GenericNode {
        Objects.requireNonNull(type, "type");
        children = children == null ? List.of() : List.copyOf(children);
        comments = comments == null ? List.of() : List.copyOf(comments);
    }

    public GenericNode(String type) {
        this(type, null, null, List.of(), List.of());
    }

    /**
     * Structural equality, compared without recursion so arbitrarily deep trees
     * can be compared.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GenericNode other)) return false;

        Deque<GenericNode[]> stack = new ArrayDeque<>();
        stack.push(new GenericNode[]{this, other});
        while (!stack.isEmpty()) {
            GenericNode[] pair = stack.pop();
            GenericNode a = pair[0];
            GenericNode b = pair[1];
            if (a == b) continue;
            if (!a.type.equals(b.type)
                || !Objects.equals(a.name, b.name)
                || !Objects.equals(a.value, b.value)
                || !a.comments.equals(b.comments)
                || a.children.size() != b.children.size()) {
                return false;
            }
            for (int i = 0; i < a.children.size(); i++) {
                stack.push(new GenericNode[]{a.children.get(i), b.children.get(i)});
            }
        }
        return true;
    }

    // Hashes the pre-order sequence of nodes; the child counts make it match equals
    @Override
    public int hashCode() {
        int hash = 1;
        Deque<GenericNode> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            GenericNode node = stack.pop();
            hash = 31 * hash + Objects.hash(node.type, node.name, node.value, node.comments, node.children.size());
            for (int i = node.children.size() - 1; i >= 0; i--) {
                stack.push(node.children.get(i));
            }
        }
        return hash;
    }

    /**
     * Describes this node only; children are summarised by their count.
     */
    @Override
    public String toString() {
        return "GenericNode[type=" + type + ", name=" + name + ", value=" + value
            + ", children=" + children.size() + ", comments=" + comments + "]";
    }

    /**
     * Total number of nodes in this subtree, counted without recursion.
     */
    public int size() {
        int count = 0;
        Deque<GenericNode> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            GenericNode node = stack.pop();
            count++;
            for (GenericNode child : node.children) {
                stack.push(child);
            }
        }
        return count;
    }
}
