package com.flowgraph.engine.discovery;

import com.flowgraph.engine.cfg.CfgBuilder;
import com.flowgraph.engine.cfg.ControlFlowGraph;
import com.flowgraph.engine.tree.GrammarProfile;
import com.flowgraph.engine.tree.ProgramNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Finds function definitions in a program tree and turns each into a control-flow graph.
 */
public class FunctionDiscovery {

    private final GrammarProfile profile;

    public FunctionDiscovery(GrammarProfile profile) {
        this.profile = profile;
    }

    /** Function definitions in pre-order. Nested definitions are reported too. */
    public List<DiscoveredFunction> discover(ProgramNode root) {
        List<DiscoveredFunction> functions = new ArrayList<>();
        collect(root, functions);
        return functions;
    }

    private void collect(ProgramNode node, List<DiscoveredFunction> out) {
        if (profile.isFunction(node.getKind())) {
            out.add(describe(node));
        }
        for (ProgramNode child : node.getChildren()) {
            collect(child, out);
        }
    }

    private DiscoveredFunction describe(ProgramNode function) {
        ProgramNode identifier = function.firstChildOfKind(Set.of(profile.getIdentifierKind()));
        String name = identifier != null && !identifier.getText().isBlank()
                ? identifier.getText().trim()
                : GrammarProfile.DEFAULT_FUNCTION_NAME;
        ProgramNode body = function.firstChildOfKind(profile.getFunctionBodyKinds());
        return new DiscoveredFunction(name, function, Optional.ofNullable(body));
    }

    /**
     * Builds the CFG of one function: walks its body (if any), then links the last
     * live block to exit to capture fallthrough at the end of the function.
     */
    public ControlFlowGraph buildControlFlowGraph(DiscoveredFunction function) {
        CfgBuilder builder = new CfgBuilder(profile);
        function.body().ifPresent(builder::visit);
        ControlFlowGraph graph = builder.getGraph();
        graph.addEdge(builder.getCurrentBlock(), graph.getExit());
        return graph;
    }
}
