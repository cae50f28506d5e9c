package com.flowgraph.engine.cfg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Arena of basic blocks addressed by index, plus a set of directed edges between indices.
 *
 * Blocks 0 and 1 are always the entry and exit blocks, holding the single lines
 * {@code Entry} and {@code Exit}. Blocks with no incoming edge (code after a return or
 * break) stay in the arena so they are still serialized.
 */
public final class ControlFlowGraph {

    public static final String ENTRY_LABEL = "Entry";
    public static final String EXIT_LABEL = "Exit";

    private final List<BasicBlock> blocks = new ArrayList<>();
    private final Set<CfgEdge> edges = new LinkedHashSet<>();
    private final int entry;
    private final int exit;

    public ControlFlowGraph() {
        this.entry = addBlock();
        blocks.get(entry).append(ENTRY_LABEL);
        this.exit = addBlock();
        blocks.get(exit).append(EXIT_LABEL);
    }

    /** Allocates a new empty block and returns its index. */
    public int addBlock() {
        blocks.add(new BasicBlock());
        return blocks.size() - 1;
    }

    /** Appends a statement line to the block at {@code index}. */
    public void appendStatement(int index, String statement) {
        block(index).append(statement);
    }

    public void addEdge(int from, int to) {
        checkIndex(from);
        checkIndex(to);
        edges.add(new CfgEdge(from, to));
    }

    public boolean hasEdge(int from, int to) {
        return edges.contains(new CfgEdge(from, to));
    }

    public BasicBlock block(int index) {
        checkIndex(index);
        return blocks.get(index);
    }

    public int getEntry()      { return entry; }
    public int getExit()       { return exit; }
    public int blockCount()    { return blocks.size(); }
    public int edgeCount()     { return edges.size(); }

    public List<BasicBlock> getBlocks() {
        return Collections.unmodifiableList(blocks);
    }

    /** Edges in insertion order. */
    public List<CfgEdge> getEdges() {
        return List.copyOf(edges);
    }

    public List<Integer> successors(int index) {
        List<Integer> result = new ArrayList<>();
        for (CfgEdge e : edges) {
            if (e.from() == index) result.add(e.to());
        }
        return result;
    }

    public List<Integer> predecessors(int index) {
        List<Integer> result = new ArrayList<>();
        for (CfgEdge e : edges) {
            if (e.to() == index) result.add(e.from());
        }
        return result;
    }

    public int inDegree(int index) {
        return predecessors(index).size();
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= blocks.size()) {
            throw new IndexOutOfBoundsException("No block " + index + " (graph has " + blocks.size() + ")");
        }
    }
}
