package com.goparser.generic;

import com.goparser.ast.Node;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Remembers which syntax nodes one classification run has already converted.
 *
 * <p>Nodes are compared by reference: two structurally equal records are still two
 * nodes. An instance belongs to a single run and is not thread-safe.</p>
 */
public final class CycleGuard {
    private final Set<Node> claimed = Collections.newSetFromMap(new IdentityHashMap<>());

    /**
     * Records {@code node} as converted.
     *
     * @return true the first time a node is claimed, false on every later call for it
     */
    public boolean claim(Node node) {
        return claimed.add(node);
    }

    public boolean isClaimed(Node node) {
        return claimed.contains(node);
    }

    public int size() {
        return claimed.size();
    }
}
