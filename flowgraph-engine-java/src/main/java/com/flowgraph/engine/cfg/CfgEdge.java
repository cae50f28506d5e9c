package com.flowgraph.engine.cfg;

/** Directed, unlabeled control transfer between two block indices. */
public record CfgEdge(int from, int to) {}
