package com.flowgraph.engine.cfg;

import com.flowgraph.engine.tree.GrammarProfile;
import com.flowgraph.engine.tree.ProgramNode;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Builds a {@link ControlFlowGraph} from the program tree of one function body by structural
 * recursion.
 *
 * The builder keeps two cursors while it walks: the block new statements and edges attach to,
 * and a stack of (header, exit) pairs for the loops currently open. One instance serves exactly
 * one function; the caller adds the final fallthrough edge to exit (see
 * {@link com.flowgraph.engine.discovery.FunctionDiscovery#buildControlFlowGraph}).
 *
 * No input makes construction fail: a missing slot child means the feature is absent.
 */
public class CfgBuilder {

    /** Open loop: where a back edge goes and where a break goes. */
    record LoopContext(int header, int exit) {}

    private final GrammarProfile profile;
    private final ControlFlowGraph graph = new ControlFlowGraph();
    private final Deque<LoopContext> loopContexts = new ArrayDeque<>();
    private int currentBlock;
    private int danglingBreaks;

    public CfgBuilder(GrammarProfile profile) {
        this.profile = profile;
        this.currentBlock = graph.getEntry();
    }

    public ControlFlowGraph getGraph()  { return graph; }
    public int getCurrentBlock()        { return currentBlock; }

    /** Breaks seen outside any loop; their edge was dropped. */
    public int getDanglingBreaks()      { return danglingBreaks; }

    int loopDepth()                     { return loopContexts.size(); }

    /** Visits {@code node} and everything below it. */
    public void visit(ProgramNode node) {
        String kind = node.getKind();

        if (profile.isBlock(kind)) {
            // A nested block does not open a new basic block.
            for (ProgramNode child : node.getChildren()) {
                visit(child);
            }
        } else if (profile.isConditional(kind)) {
            visitConditional(node);
        } else if (profile.isReturn(kind)) {
            visitReturn(node);
        } else if (profile.isLoop(kind)) {
            visitLoop(node);
        } else if (profile.isBreak(kind)) {
            visitBreak();
        } else if (profile.isStatementWrapper(kind) && structuralChild(node) != null) {
            visit(structuralChild(node));
        } else if (profile.isLeafStatement(kind)) {
            String line = node.firstLine();
            if (!line.isEmpty()) {
                graph.appendStatement(currentBlock, line);
            }
        } else {
            for (ProgramNode child : node.getChildren()) {
                visit(child);
            }
        }
    }

    private ProgramNode structuralChild(ProgramNode wrapper) {
        for (ProgramNode child : wrapper.getChildren()) {
            if (profile.isStructural(child.getKind())) return child;
        }
        return null;
    }

    private void visitConditional(ProgramNode node) {
        ProgramNode condition = node.firstChildOfKind(profile.getConditionKinds());
        String conditionText = condition != null ? condition.getText() : "";
        graph.appendStatement(currentBlock, "IF (" + conditionText + ")");

        ProgramNode consequence = node.firstChildOfKind(profile.getConsequenceKinds());
        ProgramNode alternative = node.firstChildOfKind(profile.getAlternativeKinds());

        int pre = currentBlock;
        int merge = graph.addBlock();

        if (consequence != null) {
            visitBranch(pre, consequence, merge);
        }
        if (alternative != null) {
            visitBranch(pre, alternative, merge);
        } else {
            graph.addEdge(pre, merge);
        }

        currentBlock = merge;
    }

    private void visitBranch(int pre, ProgramNode branch, int merge) {
        int start = graph.addBlock();
        graph.addEdge(pre, start);
        currentBlock = start;
        visit(branch);
        graph.addEdge(currentBlock, merge);
    }

    private void visitReturn(ProgramNode node) {
        graph.appendStatement(currentBlock, node.getText());
        graph.addEdge(currentBlock, graph.getExit());
        // Whatever follows the return syntactically lands in a block nothing jumps to.
        currentBlock = graph.addBlock();
    }

    private void visitLoop(ProgramNode node) {
        int header = graph.addBlock();
        graph.addEdge(currentBlock, header);

        int bodyStart = graph.addBlock();
        int after = graph.addBlock();

        loopContexts.push(new LoopContext(header, after));
        graph.addEdge(header, bodyStart);
        // Every loop kind may exit from its header, including unconditional loops.
        graph.addEdge(header, after);

        currentBlock = bodyStart;
        ProgramNode body = node.firstChildOfKind(profile.getLoopBodyKinds());
        if (body != null) {
            visit(body);
        }
        graph.addEdge(currentBlock, header);

        loopContexts.pop();
        currentBlock = after;
    }

    private void visitBreak() {
        graph.appendStatement(currentBlock, "break");
        LoopContext loop = loopContexts.peek();
        if (loop != null) {
            graph.addEdge(currentBlock, loop.exit());
        } else {
            danglingBreaks++;
        }
        currentBlock = graph.addBlock();
    }
}
