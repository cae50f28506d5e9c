package com.flowgraph.adapter.output;

import com.flowgraph.adapter.output.GraphModel.CfgDocument;
import com.flowgraph.adapter.output.GraphModel.CfgEdgeDto;
import com.flowgraph.adapter.output.GraphModel.CfgNodeDto;
import com.flowgraph.adapter.output.GraphModel.CpgDocument;
import com.flowgraph.adapter.output.GraphModel.CpgEdgeDto;
import com.flowgraph.adapter.output.GraphModel.CpgNodeDto;
import com.flowgraph.engine.cfg.BasicBlock;
import com.flowgraph.engine.cfg.CfgEdge;
import com.flowgraph.engine.cfg.ControlFlowGraph;
import com.flowgraph.engine.cpg.CodePropertyGraph;
import com.flowgraph.engine.cpg.CpgEdge;
import com.flowgraph.engine.cpg.CpgNode;
import com.flowgraph.engine.ir.IrLocation;
import com.flowgraph.engine.tree.ProgramNode;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import java.io.FileReader;
import java.io.FileWriter;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Writes and re-loads the pipeline's JSON artifacts: program trees, CFGs and CPGs.
 * Output is pretty-printed; node and edge arrays keep graph order, so the same graph
 * always serializes to the same bytes.
 */
public class GraphSerializer {

    public static class GraphIoException extends RuntimeException {
        public GraphIoException(String msg) { super(msg); }
        public GraphIoException(String msg, Throwable cause) { super(msg, cause); }
    }

    private final Gson gson = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    // -----------------------------------------------------------------------
    // Program trees
    // -----------------------------------------------------------------------

    public void writeProgramTree(ProgramNode root, Path file) {
        writeJson(root, file);
    }

    /** Re-loads a program tree; every node must carry a kind and no child may be null. */
    public ProgramNode readProgramTree(Path file) {
        ProgramNode root = readJson(file, ProgramNode.class);
        Deque<ProgramNode> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            ProgramNode node = pending.pop();
            if (node.getKind().isEmpty()) {
                throw new GraphIoException("Program tree node without a kind in " + file);
            }
            for (ProgramNode child : node.getChildren()) {
                if (child == null) {
                    throw new GraphIoException("Null child under '" + node.getKind() + "' node in " + file);
                }
                pending.push(child);
            }
        }
        return root;
    }

    // -----------------------------------------------------------------------
    // CFG
    // -----------------------------------------------------------------------

    public void writeCfg(String function, String source, ControlFlowGraph cfg, Path file) {
        writeJson(toDocument(function, source, cfg), file);
    }

    public CfgDocument toDocument(String function, String source, ControlFlowGraph cfg) {
        CfgDocument doc = new CfgDocument();
        doc.function = function;
        doc.source = source;
        doc.entry = cfg.getEntry();
        doc.exit = cfg.getExit();
        List<BasicBlock> blocks = cfg.getBlocks();
        for (int i = 0; i < blocks.size(); i++) {
            CfgNodeDto node = new CfgNodeDto();
            node.id = i;
            node.statements.addAll(blocks.get(i).getStatements());
            doc.nodes.add(node);
        }
        for (CfgEdge e : cfg.getEdges()) {
            CfgEdgeDto edge = new CfgEdgeDto();
            edge.from = e.from();
            edge.to = e.to();
            doc.edges.add(edge);
        }
        return doc;
    }

    /**
     * Re-loads a CFG artifact. Node ids must be dense and in order, with entry 0 and exit 1
     * whose first lines are {@code Entry} and {@code Exit}.
     */
    public ControlFlowGraph readCfg(Path file) {
        CfgDocument doc = readJson(file, CfgDocument.class);
        ControlFlowGraph cfg = new ControlFlowGraph();
        if (doc.entry != cfg.getEntry() || doc.exit != cfg.getExit() || doc.nodes == null || doc.nodes.size() < 2) {
            throw new GraphIoException("Not a CFG artifact (entry/exit blocks missing): " + file);
        }
        for (int i = 0; i < doc.nodes.size(); i++) {
            CfgNodeDto node = doc.nodes.get(i);
            if (node.id != i) {
                throw new GraphIoException("CFG node ids are not dense in " + file + ": expected " + i + ", got " + node.id);
            }
            List<String> statements = node.statements != null ? node.statements : List.of();
            int block = i;
            int skip = 0;
            if (i == cfg.getEntry() || i == cfg.getExit()) {
                String label = i == cfg.getEntry() ? ControlFlowGraph.ENTRY_LABEL : ControlFlowGraph.EXIT_LABEL;
                if (statements.isEmpty() || !statements.get(0).equals(label)) {
                    throw new GraphIoException("Block " + i + " of " + file + " must start with " + label);
                }
                skip = 1;
            } else {
                block = cfg.addBlock();
            }
            for (String statement : statements.subList(skip, statements.size())) {
                cfg.appendStatement(block, statement);
            }
        }
        if (doc.edges != null) {
            for (CfgEdgeDto edge : doc.edges) {
                try {
                    cfg.addEdge(edge.from, edge.to);
                } catch (IndexOutOfBoundsException e) {
                    throw new GraphIoException("Edge " + edge.from + " -> " + edge.to + " in " + file
                            + " names a missing block", e);
                }
            }
        }
        return cfg;
    }

    // -----------------------------------------------------------------------
    // CPG
    // -----------------------------------------------------------------------

    public void writeCpg(String function, String unit, CodePropertyGraph cpg, Path file) {
        writeJson(toDocument(function, unit, cpg), file);
    }

    public CpgDocument toDocument(String function, String unit, CodePropertyGraph cpg) {
        CpgDocument doc = new CpgDocument();
        doc.function = function;
        doc.unit = unit;
        List<CpgNode> nodes = cpg.getNodes();
        for (int i = 0; i < nodes.size(); i++) {
            CpgNodeDto node = new CpgNodeDto();
            node.id = i;
            node.label = nodes.get(i).label();
            node.block = nodes.get(i).location().block();
            node.statementIndex = nodes.get(i).location().statementIndex();
            doc.nodes.add(node);
        }
        for (CpgEdge e : cpg.getEdges()) {
            CpgEdgeDto edge = new CpgEdgeDto();
            edge.from = e.from();
            edge.to = e.to();
            edge.kind = e.kind();
            doc.edges.add(edge);
        }
        return doc;
    }

    public CodePropertyGraph readCpg(Path file) {
        CpgDocument doc = readJson(file, CpgDocument.class);
        CodePropertyGraph cpg = new CodePropertyGraph();
        List<CpgNodeDto> nodes = doc.nodes != null ? doc.nodes : List.of();
        for (int i = 0; i < nodes.size(); i++) {
            CpgNodeDto node = nodes.get(i);
            if (node.id != i) {
                throw new GraphIoException("CPG node ids are not dense in " + file + ": expected " + i + ", got " + node.id);
            }
            try {
                cpg.addNode(new CpgNode(node.label, new IrLocation(node.block, node.statementIndex)));
            } catch (IllegalArgumentException e) {
                throw new GraphIoException("Duplicate location in " + file + ": " + e.getMessage(), e);
            }
        }
        if (doc.edges != null) {
            for (CpgEdgeDto edge : doc.edges) {
                if (edge.kind == null) {
                    throw new GraphIoException("Edge " + edge.from + " -> " + edge.to + " in " + file + " has no known kind");
                }
                try {
                    cpg.addEdge(edge.from, edge.to, edge.kind);
                } catch (IndexOutOfBoundsException e) {
                    throw new GraphIoException("Edge " + edge.from + " -> " + edge.to + " in " + file
                            + " names a missing node", e);
                }
            }
        }
        return cpg;
    }

    // -----------------------------------------------------------------------
    // Files
    // -----------------------------------------------------------------------

    public void createDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new GraphIoException("Could not create output directory: " + dir, e);
        }
    }

    /** Writes {@code text} to {@code file}, creating parent directories. */
    public void writeText(String text, Path file) {
        createParent(file);
        try (Writer w = new FileWriter(file.toFile(), StandardCharsets.UTF_8)) {
            w.write(text);
        } catch (IOException e) {
            throw new GraphIoException("Failed to write " + file + ": " + e.getMessage(), e);
        }
    }

    private void writeJson(Object value, Path file) {
        createParent(file);
        try (Writer w = new FileWriter(file.toFile(), StandardCharsets.UTF_8)) {
            gson.toJson(value, w);
        } catch (IOException e) {
            throw new GraphIoException("Failed to write " + file + ": " + e.getMessage(), e);
        }
    }

    private <T> T readJson(Path file, Class<T> type) {
        T value;
        try (Reader r = new FileReader(file.toFile(), StandardCharsets.UTF_8)) {
            value = gson.fromJson(r, type);
        } catch (JsonParseException e) {
            throw new GraphIoException("Malformed JSON in " + file + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new GraphIoException("Failed to read " + file + ": " + e.getMessage(), e);
        }
        if (value == null) {
            throw new GraphIoException("Empty document: " + file);
        }
        return value;
    }

    private void createParent(Path file) {
        createDirectory(file.toAbsolutePath().getParent());
    }
}
