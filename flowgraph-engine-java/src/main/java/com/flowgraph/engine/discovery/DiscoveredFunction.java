package com.flowgraph.engine.discovery;

import com.flowgraph.engine.tree.ProgramNode;

import java.util.Optional;

/**
 * A function definition found in a program tree.
 *
 * @param name       first identifier child, or the placeholder name
 * @param definition the function node itself
 * @param body       first block child, absent for declarations without a body
 */
public record DiscoveredFunction(String name, ProgramNode definition, Optional<ProgramNode> body) {}
