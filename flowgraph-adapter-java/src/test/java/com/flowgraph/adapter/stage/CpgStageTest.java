package com.flowgraph.adapter.stage;

import com.flowgraph.adapter.config.PipelineConfig;
import com.flowgraph.adapter.ir.IrFrontend;
import com.flowgraph.adapter.ir.IrFrontend.IrFrontendException;
import com.flowgraph.adapter.output.GraphSerializer;
import com.flowgraph.engine.cpg.CodePropertyGraph;
import com.flowgraph.engine.cpg.EdgeKind;
import com.flowgraph.engine.ir.IrModel.IrBlock;
import com.flowgraph.engine.ir.IrModel.IrFunction;
import com.flowgraph.engine.ir.IrModel.IrTerminator;
import com.flowgraph.engine.ir.IrModel.IrUnit;
import com.flowgraph.engine.ir.IrModel.TerminatorKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class CpgStageTest {

    static final Path VAULT = Paths.get(
            System.getProperty("user.dir"),
            "..", "test-fixtures", "vault-program").normalize();

    private final GraphSerializer serializer = new GraphSerializer();
    private final CpgStage stage = new CpgStage(PipelineConfig.defaults());

    private static IrFunction returnOnly(String name) {
        IrTerminator ret = new IrTerminator();
        ret.kind = TerminatorKind.RETURN;
        ret.text = "return";
        IrBlock block = new IrBlock();
        block.id = 0;
        block.terminator = ret;
        IrFunction f = new IrFunction();
        f.name = name;
        f.blocks.add(block);
        return f;
    }

    // --- MIR dump ---

    @Test
    void mirDumpProducesOneGraphPerFunction(@TempDir Path tmp) {
        StageReport report = stage.run(VAULT.resolve("mir/vault.mir"), tmp);
        assertEquals("cpg", report.getStage());
        assertEquals(3, report.getFunctions());
        assertEquals(6, report.getArtifacts().size());
        assertTrue(report.getFailures().isEmpty());
    }

    @Test
    void implMethodsWriteOneArtifactEach(@TempDir Path tmp) throws IOException {
        Path mir = Files.writeString(tmp.resolve("vault.mir"), """
                fn <impl at src/lib.rs:3:1: 3:11>::deposit(_1: &mut Vault) -> () {
                    bb0: {
                        return;
                    }
                }

                fn <impl at src/lib.rs:3:1: 3:11>::withdraw(_1: &mut Vault) -> () {
                    bb0: {
                        return;
                    }
                }
                """);
        Path out = tmp.resolve("out");
        StageReport report = stage.run(mir, out);

        assertEquals(2, report.getFunctions());
        assertTrue(Files.exists(out.resolve("vault._impl_at_src_lib.rs_3_1__3_11___deposit.cpg.json")));
        assertTrue(Files.exists(out.resolve("vault._impl_at_src_lib.rs_3_1__3_11___withdraw.cpg.json")));
    }

    @Test
    void checkedAddFlowsIntoTheProjectionAfterTheAssert(@TempDir Path tmp) {
        stage.run(VAULT.resolve("mir/vault.mir"), tmp);
        CodePropertyGraph cpg = serializer.readCpg(tmp.resolve("vault.deposit.cpg.json"));

        assertEquals(4, cpg.nodeCount());
        assertTrue(cpg.hasEdge(1, 2, EdgeKind.CONTROL_FLOW));
        assertTrue(cpg.hasEdge(0, 2, EdgeKind.DATA_FLOW));
        assertEquals(2, cpg.edgeCount());
    }

    @Test
    void switchBranchesAndMergeInWithdraw(@TempDir Path tmp) {
        stage.run(VAULT.resolve("mir/vault.mir"), tmp);
        CodePropertyGraph cpg = serializer.readCpg(tmp.resolve("vault.withdraw.cpg.json"));

        assertEquals(12, cpg.nodeCount());
        assertEquals("switchInt(move _3) -> [0: bb2, otherwise: bb1];", cpg.node(2).label());
        // Comparison feeds the switch; the subtraction feeds the Some(..) aggregate.
        assertTrue(cpg.hasEdge(1, 2, EdgeKind.DATA_FLOW));
        assertTrue(cpg.hasEdge(6, 7, EdgeKind.DATA_FLOW));
        assertEquals(2, cpg.edgesOfKind(EdgeKind.DATA_FLOW).size());
        // Successor order is kept: bb2 first, then bb1.
        assertTrue(cpg.hasEdge(2, 5, EdgeKind.CONTROL_FLOW));
        assertTrue(cpg.hasEdge(2, 3, EdgeKind.CONTROL_FLOW));
        assertTrue(cpg.hasEdge(4, 10, EdgeKind.CONTROL_FLOW));
        assertTrue(cpg.hasEdge(9, 10, EdgeKind.CONTROL_FLOW));
        assertEquals(4, cpg.edgesOfKind(EdgeKind.CONTROL_FLOW).size());
    }

    @Test
    void callArgumentsAreUsesButDestinationIsNotADefinition(@TempDir Path tmp) {
        stage.run(VAULT.resolve("mir/vault.mir"), tmp);
        CodePropertyGraph cpg = serializer.readCpg(tmp.resolve("vault.audit.cpg.json"));

        assertEquals(3, cpg.nodeCount());
        assertTrue(cpg.hasEdge(0, 1, EdgeKind.DATA_FLOW));
        assertTrue(cpg.hasEdge(1, 2, EdgeKind.CONTROL_FLOW));
        assertEquals(2, cpg.edgeCount());
    }

    // --- JSON IR ---

    @Test
    void straightLineChainFromJsonIr(@TempDir Path tmp) throws IOException {
        stage.run(VAULT.resolve("ir/vault.ir.json"), tmp);
        CodePropertyGraph relay = serializer.readCpg(tmp.resolve("vault.relay.cpg.json"));

        assertEquals(4, relay.nodeCount());
        assertTrue(relay.hasEdge(0, 1, EdgeKind.DATA_FLOW));
        assertTrue(relay.hasEdge(1, 2, EdgeKind.DATA_FLOW));
        assertTrue(relay.edgesOfKind(EdgeKind.CONTROL_FLOW).isEmpty());

        String json = Files.readString(tmp.resolve("vault.relay.cpg.json"), StandardCharsets.UTF_8);
        assertTrue(json.contains("\"unit\": \"vault.rs\""), json);
    }

    @Test
    void emptyBlockIsEnteredAtItsTerminator(@TempDir Path tmp) {
        stage.run(VAULT.resolve("ir/vault.ir.json"), tmp);
        CodePropertyGraph settle = serializer.readCpg(tmp.resolve("vault.settle.cpg.json"));

        assertEquals(7, settle.nodeCount());
        assertTrue(settle.hasEdge(0, 1, EdgeKind.DATA_FLOW));
        assertTrue(settle.hasEdge(1, 4, EdgeKind.CONTROL_FLOW));
        assertTrue(settle.hasEdge(1, 2, EdgeKind.CONTROL_FLOW));
        assertTrue(settle.hasEdge(3, 6, EdgeKind.CONTROL_FLOW));
        assertTrue(settle.hasEdge(5, 6, EdgeKind.CONTROL_FLOW));
        assertEquals(5, settle.edgeCount());
    }

    @Test
    void dotArtifactDashesDataFlow(@TempDir Path tmp) throws IOException {
        stage.run(VAULT.resolve("ir/vault.ir.json"), tmp);
        String dot = Files.readString(tmp.resolve("vault.relay.cpg.dot"), StandardCharsets.UTF_8);
        assertTrue(dot.startsWith("digraph \"relay\" {\n"), dot);
        assertTrue(dot.contains("    0 -> 1 [ style = dashed ];\n"), dot);
    }

    // --- Frontends ---

    @Test
    void frontendFailureIsFatal(@TempDir Path tmp) {
        assertThrows(IrFrontendException.class, () -> stage.run(tmp.resolve("absent.ir.json"), tmp.resolve("out")));
    }

    @Test
    void explicitFrontendWithRepeatedNames(@TempDir Path tmp) {
        IrFrontend frontend = unit -> {
            IrUnit ir = new IrUnit();
            ir.unit = "lib.rs";
            ir.functions.add(returnOnly("new"));
            ir.functions.add(returnOnly("new"));
            return ir;
        };
        StageReport report = stage.run(Paths.get("lib.rs"), tmp, frontend);
        assertEquals(2, report.getFunctions());
        assertTrue(Files.exists(tmp.resolve("lib.new.cpg.json")));
        assertTrue(Files.exists(tmp.resolve("lib.new_2.cpg.json")));
        assertEquals(1, serializer.readCpg(tmp.resolve("lib.new_2.cpg.json")).nodeCount());
    }
}
