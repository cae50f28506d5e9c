package com.flowgraph.engine.cpg;

import java.util.HashMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Last definer of each local, in the order instructions were scanned.
 *
 * One map covers the whole function and is never joined at merge points: a definition on one
 * branch is visible to uses on a sibling branch scanned later. Entries are overwritten, never
 * removed.
 */
public class DefUseTracker {

    private final Map<Integer, Integer> lastDefinition = new HashMap<>();

    public void define(int local, int node) {
        lastDefinition.put(local, node);
    }

    public OptionalInt lastDefinition(int local) {
        Integer node = lastDefinition.get(local);
        return node != null ? OptionalInt.of(node) : OptionalInt.empty();
    }

    public int size() {
        return lastDefinition.size();
    }
}
