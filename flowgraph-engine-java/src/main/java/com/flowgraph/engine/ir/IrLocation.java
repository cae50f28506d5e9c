package com.flowgraph.engine.ir;

/**
 * Position of an instruction inside a function's IR.
 * {@code statementIndex == statements.size()} addresses the block's terminator.
 */
public record IrLocation(int block, int statementIndex) implements Comparable<IrLocation> {

    @Override
    public int compareTo(IrLocation other) {
        int c = Integer.compare(block, other.block);
        return c != 0 ? c : Integer.compare(statementIndex, other.statementIndex);
    }

    @Override
    public String toString() {
        return "bb" + block + "[" + statementIndex + "]";
    }
}
