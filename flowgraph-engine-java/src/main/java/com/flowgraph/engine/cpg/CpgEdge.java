package com.flowgraph.engine.cpg;

public record CpgEdge(int from, int to, EdgeKind kind) {}
