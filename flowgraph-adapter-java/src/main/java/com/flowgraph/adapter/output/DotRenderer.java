package com.flowgraph.adapter.output;

import com.flowgraph.engine.cfg.CfgEdge;
import com.flowgraph.engine.cfg.ControlFlowGraph;
import com.flowgraph.engine.cpg.CodePropertyGraph;
import com.flowgraph.engine.cpg.CpgEdge;
import com.flowgraph.engine.cpg.EdgeKind;

import java.util.List;

/**
 * Renders graphs as Graphviz DOT. Block nodes are labelled with their statement lines;
 * edges carry no labels. In a CPG, data-flow edges are dashed.
 */
public class DotRenderer {

    public String renderCfg(String name, ControlFlowGraph cfg) {
        StringBuilder sb = header(name);
        for (int i = 0; i < cfg.blockCount(); i++) {
            List<String> statements = cfg.block(i).getStatements();
            sb.append("    ").append(i).append(" [ label = \"")
              .append(escape(String.join("\n", statements)))
              .append("\" ];\n");
        }
        for (CfgEdge e : cfg.getEdges()) {
            sb.append("    ").append(e.from()).append(" -> ").append(e.to()).append(" [ ];\n");
        }
        return sb.append("}\n").toString();
    }

    public String renderCpg(String name, CodePropertyGraph cpg) {
        StringBuilder sb = header(name);
        for (int i = 0; i < cpg.nodeCount(); i++) {
            sb.append("    ").append(i).append(" [ label = \"")
              .append(escape(cpg.node(i).label()))
              .append("\" ];\n");
        }
        for (CpgEdge e : cpg.getEdges()) {
            sb.append("    ").append(e.from()).append(" -> ").append(e.to())
              .append(e.kind() == EdgeKind.DATA_FLOW ? " [ style = dashed ];\n" : " [ ];\n");
        }
        return sb.append("}\n").toString();
    }

    private static StringBuilder header(String name) {
        return new StringBuilder()
                .append("digraph \"").append(escape(name)).append("\" {\n")
                .append("    node [ shape = box, fontname = \"monospace\" ];\n");
    }

    static String escape(String text) {
        return text.replace("\\", "\\\\")
                   .replace("\"", "\\\"")
                   .replace("\r", "")
                   .replace("\n", "\\n");
    }
}
