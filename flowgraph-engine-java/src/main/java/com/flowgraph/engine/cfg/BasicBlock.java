package com.flowgraph.engine.cfg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered list of one-line statement summaries. Lines are only ever appended.
 * A block's identity is its index in the owning {@link ControlFlowGraph}.
 */
public final class BasicBlock {

    private final List<String> statements = new ArrayList<>();

    BasicBlock() {}

    void append(String statement) {
        statements.add(statement);
    }

    public List<String> getStatements() {
        return Collections.unmodifiableList(statements);
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    @Override
    public String toString() {
        return "BasicBlock" + statements;
    }
}
