package com.flowgraph.adapter.source;

import com.flowgraph.engine.tree.ProgramNode;

import java.nio.file.Path;

/** Turns one source file into a program tree. */
@FunctionalInterface
public interface ProgramTreeParser {

    ProgramNode parseFile(Path file);
}
