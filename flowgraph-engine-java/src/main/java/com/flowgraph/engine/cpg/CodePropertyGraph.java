package com.flowgraph.engine.cpg;

import com.flowgraph.engine.ir.IrLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Arena of per-instruction nodes with typed edges. There is no distinguished entry or exit;
 * consumers take block 0 as entry and terminators without successors as exits.
 */
public final class CodePropertyGraph {

    private final List<CpgNode> nodes = new ArrayList<>();
    private final Map<IrLocation, Integer> byLocation = new HashMap<>();
    private final Set<CpgEdge> edges = new LinkedHashSet<>();

    /** Adds a node; a location may only be registered once. */
    public int addNode(CpgNode node) {
        Integer existing = byLocation.putIfAbsent(node.location(), nodes.size());
        if (existing != null) {
            throw new IllegalArgumentException("Location already has a node: " + node.location());
        }
        nodes.add(node);
        return nodes.size() - 1;
    }

    public void addEdge(int from, int to, EdgeKind kind) {
        if (from < 0 || from >= nodes.size() || to < 0 || to >= nodes.size()) {
            throw new IndexOutOfBoundsException("Edge " + from + " -> " + to + " outside " + nodes.size() + " nodes");
        }
        edges.add(new CpgEdge(from, to, kind));
    }

    public OptionalInt indexOf(IrLocation location) {
        Integer index = byLocation.get(location);
        return index != null ? OptionalInt.of(index) : OptionalInt.empty();
    }

    public CpgNode node(int index) {
        return nodes.get(index);
    }

    public List<CpgNode> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    /** Edges in insertion order. */
    public List<CpgEdge> getEdges() {
        return List.copyOf(edges);
    }

    public List<CpgEdge> edgesOfKind(EdgeKind kind) {
        return edges.stream().filter(e -> e.kind() == kind).collect(Collectors.toList());
    }

    public boolean hasEdge(int from, int to, EdgeKind kind) {
        return edges.contains(new CpgEdge(from, to, kind));
    }

    public int nodeCount() { return nodes.size(); }
    public int edgeCount() { return edges.size(); }
}
