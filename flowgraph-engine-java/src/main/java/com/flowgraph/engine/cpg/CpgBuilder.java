package com.flowgraph.engine.cpg;

import com.flowgraph.engine.ir.IrLocation;
import com.flowgraph.engine.ir.IrModel.IrBlock;
import com.flowgraph.engine.ir.IrModel.IrFunction;
import com.flowgraph.engine.ir.IrModel.IrOperand;
import com.flowgraph.engine.ir.IrModel.IrRvalue;
import com.flowgraph.engine.ir.IrModel.IrStatement;
import com.flowgraph.engine.ir.IrModel.IrTerminator;
import com.flowgraph.engine.ir.IrModel.StatementKind;

import java.util.List;
import java.util.OptionalInt;

/**
 * Builds the code property graph of one IR function.
 *
 * Pass 1 creates one node per statement and one per terminator. Pass 2 walks blocks and
 * statements in order, adding data-flow edges from the last definer of every used local
 * (see {@link DefUseTracker}) and control-flow edges from each terminator to the first node of
 * every successor block.
 */
public class CpgBuilder {

    public CodePropertyGraph build(IrFunction function) {
        CodePropertyGraph graph = new CodePropertyGraph();
        createNodes(function, graph);
        createEdges(function, graph);
        return graph;
    }

    // -----------------------------------------------------------------------
    // Pass 1: nodes
    // -----------------------------------------------------------------------

    private void createNodes(IrFunction function, CodePropertyGraph graph) {
        for (IrBlock block : function.getBlocks()) {
            List<IrStatement> statements = block.getStatements();
            for (int i = 0; i < statements.size(); i++) {
                graph.addNode(new CpgNode(labelOf(statements.get(i)), new IrLocation(block.id, i)));
            }
            if (block.terminator == null) {
                throw new IllegalArgumentException(
                        "Block bb" + block.id + " of " + function.name + " has no terminator");
            }
            graph.addNode(new CpgNode(labelOf(block.terminator), new IrLocation(block.id, statements.size())));
        }
    }

    // -----------------------------------------------------------------------
    // Pass 2: edges
    // -----------------------------------------------------------------------

    private void createEdges(IrFunction function, CodePropertyGraph graph) {
        DefUseTracker defs = new DefUseTracker();

        for (IrBlock block : function.getBlocks()) {
            List<IrStatement> statements = block.getStatements();
            for (int i = 0; i < statements.size(); i++) {
                IrStatement statement = statements.get(i);
                int node = lookup(graph, new IrLocation(block.id, i));

                if (statement.kind == StatementKind.ASSIGN && statement.place != null) {
                    visitRvalue(statement.rvalue, node, defs, graph);
                    defs.define(statement.place.local, node);
                }
            }

            IrTerminator terminator = block.terminator;
            int terminatorNode = lookup(graph, new IrLocation(block.id, statements.size()));
            visitTerminator(terminator, terminatorNode, defs, graph);

            for (int successor : terminator.getSuccessors()) {
                // Statement 0 of an empty block is its terminator.
                int target = lookup(graph, new IrLocation(successor, 0));
                graph.addEdge(terminatorNode, target, EdgeKind.CONTROL_FLOW);
            }
        }
    }

    private void visitRvalue(IrRvalue rvalue, int useNode, DefUseTracker defs, CodePropertyGraph graph) {
        if (rvalue == null || rvalue.kind == null) return;
        List<IrOperand> operands = rvalue.getOperands();
        switch (rvalue.kind) {
            case USE, COPY_FOR_DEREF, UNARY_OP -> visitOperands(operands, 1, useNode, defs, graph);
            case BINARY_OP, CHECKED_BINARY_OP  -> visitOperands(operands, 2, useNode, defs, graph);
            case AGGREGATE                     -> visitOperands(operands, operands.size(), useNode, defs, graph);
            default -> { }  // other shapes record no uses
        }
    }

    private void visitTerminator(IrTerminator terminator, int useNode, DefUseTracker defs, CodePropertyGraph graph) {
        if (terminator.kind == null) return;
        switch (terminator.kind) {
            case CALL -> visitOperands(terminator.getArgs(), terminator.getArgs().size(), useNode, defs, graph);
            case SWITCH_INT -> visitOperand(terminator.discriminant, useNode, defs, graph);
            default -> { }
        }
    }

    private void visitOperands(List<IrOperand> operands, int count, int useNode,
                               DefUseTracker defs, CodePropertyGraph graph) {
        for (int i = 0; i < Math.min(count, operands.size()); i++) {
            visitOperand(operands.get(i), useNode, defs, graph);
        }
    }

    private void visitOperand(IrOperand operand, int useNode, DefUseTracker defs, CodePropertyGraph graph) {
        if (operand == null || operand.place == null || operand.kind == null) return;
        switch (operand.kind) {
            case COPY, MOVE -> {
                OptionalInt definition = defs.lastDefinition(operand.place.local);
                if (definition.isPresent()) {
                    graph.addEdge(definition.getAsInt(), useNode, EdgeKind.DATA_FLOW);
                }
            }
            default -> { }
        }
    }

    private int lookup(CodePropertyGraph graph, IrLocation location) {
        OptionalInt index = graph.indexOf(location);
        if (index.isEmpty()) {
            throw new IllegalStateException("No CPG node for " + location + "; IR block missing from pass 1");
        }
        return index.getAsInt();
    }

    // -----------------------------------------------------------------------
    // Labels
    // -----------------------------------------------------------------------

    private static String labelOf(IrStatement statement) {
        if (statement.text != null && !statement.text.isEmpty()) return statement.text;
        if (statement.place != null) {
            String target = statement.place.text != null ? statement.place.text : "_" + statement.place.local;
            return target + " = " + (statement.rvalue != null && statement.rvalue.kind != null
                    ? statement.rvalue.kind.name() : "?");
        }
        return statement.kind != null ? statement.kind.name() : "<statement>";
    }

    private static String labelOf(IrTerminator terminator) {
        if (terminator.text != null && !terminator.text.isEmpty()) return terminator.text;
        String kind = terminator.kind != null ? terminator.kind.name() : "<terminator>";
        return terminator.getSuccessors().isEmpty() ? kind : kind + " -> " + terminator.getSuccessors();
    }
}
