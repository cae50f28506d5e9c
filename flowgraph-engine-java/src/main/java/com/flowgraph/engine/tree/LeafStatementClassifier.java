package com.flowgraph.engine.tree;

/**
 * Decides whether a node the CFG builder has no dedicated rule for is a leaf statement
 * (summarized as one line in the current block) or a transparent container (recursed into).
 */
@FunctionalInterface
public interface LeafStatementClassifier {

    boolean isLeafStatement(String kind);
}
