package com.flowgraph.adapter.stage;

import com.flowgraph.adapter.config.ConfigReader;
import com.flowgraph.adapter.config.PipelineConfig;
import com.flowgraph.adapter.output.GraphSerializer;
import com.flowgraph.engine.cfg.ControlFlowGraph;
import com.flowgraph.engine.tree.ProgramNode;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CfgStageTest {

    static final Path VAULT = Paths.get(
            System.getProperty("user.dir"),
            "..", "test-fixtures", "vault-program").normalize();

    @TempDir
    static Path shared;

    static Path javaCfgs;
    static StageReport javaReport;

    private final GraphSerializer serializer = new GraphSerializer();

    @BeforeAll
    static void buildJavaGraphs() {
        Path ast = shared.resolve("ast");
        javaCfgs = shared.resolve("cfg");
        new AstStage(PipelineConfig.defaults()).run(VAULT.resolve("src"), ast);
        javaReport = new CfgStage(PipelineConfig.defaults()).run(ast, javaCfgs);
    }

    // --- Java sources ---

    @Test
    void everyMethodAndConstructorGetsAGraph() {
        assertEquals(2, javaReport.getSucceeded());
        assertEquals(8, javaReport.getFunctions());
        assertEquals(16, javaReport.getArtifacts().size());
        for (String name : List.of("Vault", "deposit", "withdraw", "drain", "balance")) {
            assertTrue(Files.exists(javaCfgs.resolve("com/vault/Vault.java." + name + ".cfg.json")), name);
            assertTrue(Files.exists(javaCfgs.resolve("com/vault/Vault.java." + name + ".cfg.dot")), name);
        }
    }

    @Test
    void ifElseWithEarlyReturn() {
        ControlFlowGraph cfg = serializer.readCfg(javaCfgs.resolve("com/vault/Vault.java.withdraw.cfg.json"));
        assertEquals(7, cfg.blockCount());
        assertEquals(List.of("Entry", "IF (amount > balance)"), cfg.block(0).getStatements());
        assertEquals(List.of("return false;"), cfg.block(3).getStatements());
        assertEquals(List.of("balance -= amount;"), cfg.block(5).getStatements());
        assertEquals(List.of("return true;"), cfg.block(2).getStatements());
        assertTrue(cfg.hasEdge(0, 3));
        assertTrue(cfg.hasEdge(0, 5));
        assertTrue(cfg.hasEdge(3, 1));
        assertTrue(cfg.hasEdge(5, 2));
        assertTrue(cfg.hasEdge(2, 1));
        assertFalse(cfg.hasEdge(0, 2), "if/else must not add the fallthrough edge");
        assertEquals(0, cfg.inDegree(4));
    }

    @Test
    void breakInsideEnhancedFor() {
        ControlFlowGraph cfg = serializer.readCfg(javaCfgs.resolve("com/vault/Vault.java.drain.cfg.json"));
        assertEquals(9, cfg.blockCount());
        assertEquals(List.of("Entry", "int served = 0;"), cfg.block(0).getStatements());
        assertEquals(List.of("IF (r > balance)"), cfg.block(3).getStatements());
        assertEquals(List.of("break"), cfg.block(6).getStatements());
        assertEquals(List.of("balance -= r;", "served++;"), cfg.block(5).getStatements());
        assertEquals(List.of("return served;"), cfg.block(4).getStatements());
        assertTrue(cfg.hasEdge(6, 4));
        assertTrue(cfg.hasEdge(5, 2));
        assertTrue(cfg.hasEdge(2, 3));
        assertTrue(cfg.hasEdge(2, 4));
    }

    @Test
    void throwIsAPlainStatement() {
        ControlFlowGraph cfg = serializer.readCfg(javaCfgs.resolve("com/vault/Vault.java.deposit.cfg.json"));
        assertEquals(5, cfg.blockCount());
        assertEquals(List.of("throw new IllegalArgumentException(\"amount must be positive\");"),
                cfg.block(3).getStatements());
        assertTrue(cfg.hasEdge(3, 2));
        assertEquals(List.of("balance += amount;", "return balance;"), cfg.block(2).getStatements());
    }

    @Test
    void switchCasesAreTransparentContainers() {
        ControlFlowGraph cfg = serializer.readCfg(javaCfgs.resolve("com/vault/Ledger.java.describe.cfg.json"));
        assertEquals(5, cfg.blockCount());
        assertEquals(List.of("Entry", "return \"empty\";"), cfg.block(0).getStatements());
        assertEquals(4, cfg.edgeCount());
        assertTrue(cfg.hasEdge(0, 1));
        assertTrue(cfg.hasEdge(2, 1));
        assertTrue(cfg.hasEdge(3, 1));
        assertTrue(cfg.hasEdge(4, 1));
    }

    @Test
    void continueInsideTryStaysInTheLoopBody() {
        ControlFlowGraph cfg = serializer.readCfg(javaCfgs.resolve("com/vault/Ledger.java.parseAll.cfg.json"));
        assertEquals(6, cfg.blockCount());
        assertEquals(List.of("parsed.add(Long.parseLong(raw[i].trim()));", "continue;"),
                cfg.block(3).getStatements());
        assertTrue(cfg.hasEdge(3, 2));
    }

    @Test
    void dotArtifactNamesTheFunction() throws IOException {
        String dot = Files.readString(javaCfgs.resolve("com/vault/Vault.java.withdraw.cfg.dot"));
        assertTrue(dot.startsWith("digraph \"withdraw\" {\n"), dot);
        assertTrue(dot.contains("    3 -> 1 [ ];\n"), dot);
    }

    // --- tree-sitter Rust dumps ---

    @Test
    void rustTreeUsesSuffixClassificationByDefault(@TempDir Path tmp) {
        StageReport report = new CfgStage(PipelineConfig.defaults()).run(VAULT.resolve("ast"), tmp);
        assertEquals(1, report.getSucceeded());
        assertEquals(2, report.getFunctions());

        // expression_statement ends in _statement, so a wrapped if/loop is one summary line
        ControlFlowGraph process = serializer.readCfg(tmp.resolve("lib.rs.process_instruction.cfg.json"));
        assertEquals(2, process.blockCount());
        assertEquals(List.of("Entry", "let mut total = 0;", "if amount > limit {", "total += amount;"),
                process.block(0).getStatements());
        assertEquals(1, process.getEdges().size());
        assertTrue(process.hasEdge(0, 1));

        ControlFlowGraph sweep = serializer.readCfg(tmp.resolve("lib.rs.sweep.cfg.json"));
        assertEquals(2, sweep.blockCount());
        assertEquals(List.of("Entry", "let mut swept = 0;", "loop {"), sweep.block(0).getStatements());
    }

    @Test
    void configuredWrapperProfileUnwrapsStructuralExpressions(@TempDir Path tmp) throws IOException {
        Path config = Files.writeString(tmp.resolve("flowgraph.json"), """
                {
                  "profiles": {
                    "rs": { "base": "rust", "statement_wrapper_kinds": ["expression_statement"] }
                  }
                }
                """);
        StageReport report = new CfgStage(new ConfigReader().read(config))
                .run(VAULT.resolve("ast"), tmp.resolve("out"));
        assertEquals(2, report.getFunctions());

        ControlFlowGraph process = serializer.readCfg(tmp.resolve("out/lib.rs.process_instruction.cfg.json"));
        assertEquals(5, process.blockCount());
        assertEquals(List.of("Entry", "let mut total = 0;", "IF (amount > limit)"),
                process.block(0).getStatements());
        assertEquals(List.of("return Err(VaultError::OverLimit)"), process.block(3).getStatements());
        assertEquals(List.of("total += amount;"), process.block(2).getStatements());
        assertTrue(process.hasEdge(3, 1));
        assertTrue(process.hasEdge(0, 2));
        assertTrue(process.hasEdge(2, 1));

        ControlFlowGraph sweep = serializer.readCfg(tmp.resolve("out/lib.rs.sweep.cfg.json"));
        assertEquals(8, sweep.blockCount());
        assertEquals(List.of("IF (balances.is_empty())"), sweep.block(3).getStatements());
        assertEquals(List.of("break"), sweep.block(6).getStatements());
        assertEquals(List.of("swept += balances.pop().unwrap();"), sweep.block(5).getStatements());
        assertTrue(sweep.hasEdge(6, 4));
        assertTrue(sweep.hasEdge(5, 2));
        assertTrue(sweep.hasEdge(4, 1));
    }

    @Test
    void malformedTreeFailsOnlyItsOwnUnit(@TempDir Path tmp) throws IOException {
        Path in = Files.createDirectories(tmp.resolve("in"));
        Files.copy(VAULT.resolve("ast/lib.rs.ast.json"), in.resolve("good.rs.ast.json"));
        Files.writeString(in.resolve("broken.rs.ast.json"), "{ \"kind\": \"source_file\", \"children\": [");

        StageReport report = new CfgStage(PipelineConfig.defaults()).run(in, tmp.resolve("out"));
        assertEquals(2, report.getProcessed());
        assertEquals(1, report.getSucceeded());
        assertEquals(1, report.getFailures().size());
        assertEquals("broken.rs.ast.json", report.getFailures().get(0).unit());
        assertTrue(Files.exists(tmp.resolve("out/good.rs.sweep.cfg.json")));
    }

    @Test
    void treeWithNullChildFailsOnlyItsOwnUnit(@TempDir Path tmp) throws IOException {
        Path in = Files.createDirectories(tmp.resolve("in"));
        Files.writeString(in.resolve("a.rs.ast.json"), "{ \"kind\": \"source_file\", \"children\": [null] }");
        Files.writeString(in.resolve("b.rs.ast.json"), """
                { "kind": "source_file", "children": [
                  { "kind": "function_item", "text": "fn g() {}", "children": [
                    { "kind": "identifier", "text": "g" },
                    { "kind": "block", "text": "{}" } ] } ] }
                """);

        StageReport report = new CfgStage(PipelineConfig.defaults()).run(in, tmp.resolve("out"));
        assertEquals(2, report.getProcessed());
        assertEquals(1, report.getFailures().size());
        assertEquals("a.rs.ast.json", report.getFailures().get(0).unit());
        assertTrue(Files.exists(tmp.resolve("out/b.rs.g.cfg.json")));
    }

    @Test
    void duplicateFunctionNamesGetDistinctArtifacts(@TempDir Path tmp) {
        ProgramNode tree = ProgramNode.of("source_file", "",
                ProgramNode.of("function_item", "fn f() {}", ProgramNode.leaf("identifier", "f"),
                        ProgramNode.leaf("block", "{}")),
                ProgramNode.of("function_item", "fn f() { g(); }", ProgramNode.leaf("identifier", "f"),
                        ProgramNode.of("block", "{ g(); }", ProgramNode.leaf("expression_statement", "g();"))));
        Path in = tmp.resolve("in");
        serializer.writeProgramTree(tree, in.resolve("dup.rs.ast.json"));

        StageReport report = new CfgStage(PipelineConfig.defaults()).run(in, tmp.resolve("out"));
        assertEquals(2, report.getFunctions());
        ControlFlowGraph first = serializer.readCfg(tmp.resolve("out/dup.rs.f.cfg.json"));
        ControlFlowGraph second = serializer.readCfg(tmp.resolve("out/dup.rs.f_2.cfg.json"));
        assertEquals(List.of("Entry"), first.block(0).getStatements());
        assertEquals(List.of("Entry", "g();"), second.block(0).getStatements());
    }

    @Test
    void jsonOnlyOutput(@TempDir Path tmp) throws IOException {
        Path config = Files.writeString(tmp.resolve("flowgraph.json"), "{ \"write_dot\": false }");
        StageReport report = new CfgStage(new ConfigReader().read(config)).run(VAULT.resolve("ast"), tmp.resolve("out"));
        assertEquals(2, report.getArtifacts().size());
        assertFalse(Files.exists(tmp.resolve("out/lib.rs.sweep.cfg.dot")));
    }
}
