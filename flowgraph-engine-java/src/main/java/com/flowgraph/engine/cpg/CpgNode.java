package com.flowgraph.engine.cpg;

import com.flowgraph.engine.ir.IrLocation;

/** One IR instruction or terminator, labelled with its rendered text. */
public record CpgNode(String label, IrLocation location) {}
