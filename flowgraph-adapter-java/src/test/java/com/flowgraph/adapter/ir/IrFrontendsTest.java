package com.flowgraph.adapter.ir;

import com.flowgraph.adapter.config.PipelineConfig;
import com.flowgraph.adapter.ir.IrFrontend.IrFrontendException;
import com.flowgraph.engine.ir.IrModel.IrFunction;
import com.flowgraph.engine.ir.IrModel.IrUnit;
import com.flowgraph.engine.ir.IrModel.RvalueKind;
import com.flowgraph.engine.ir.IrModel.TerminatorKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class IrFrontendsTest {

    static final Path VAULT = Paths.get(
            System.getProperty("user.dir"),
            "..", "test-fixtures", "vault-program").normalize();

    @Test
    void frontendIsChosenByFileName() {
        PipelineConfig config = PipelineConfig.defaults();
        assertInstanceOf(IrJsonFrontend.class, IrFrontends.forUnit(Paths.get("out/vault.ir.json"), config));
        assertInstanceOf(MirFileFrontend.class, IrFrontends.forUnit(Paths.get("vault.mir"), config));
        assertInstanceOf(RustcMirFrontend.class, IrFrontends.forUnit(Paths.get("program/src/lib.rs"), config));
    }

    @Test
    void unitStemDropsIrAndSourceExtensions() {
        assertEquals("vault", IrFrontends.unitStem(Paths.get("ir/vault.ir.json")));
        assertEquals("vault", IrFrontends.unitStem(Paths.get("vault.mir")));
        assertEquals("lib", IrFrontends.unitStem(Paths.get("src/lib.rs")));
        assertEquals("Makefile", IrFrontends.unitStem(Paths.get("Makefile")));
    }

    // --- JSON documents ---

    @Test
    void jsonDocumentLoadsWithKindsAndTarget() {
        IrUnit unit = new IrJsonFrontend().load(VAULT.resolve("ir/vault.ir.json"));
        assertEquals("vault.rs", unit.unit);
        assertEquals("bpfel-unknown-unknown", unit.target);
        assertEquals(2, unit.getFunctions().size());

        IrFunction settle = unit.getFunctions().get(1);
        assertEquals("settle", settle.name);
        assertEquals(RvalueKind.BINARY_OP, settle.getBlocks().get(0).getStatements().get(0).rvalue.kind);
        assertEquals(TerminatorKind.SWITCH_INT, settle.getBlocks().get(0).terminator.kind);
        assertEquals(2, settle.getBlocks().get(0).terminator.discriminant.place.local);
    }

    @Test
    void unitNameDefaultsToFileName(@TempDir Path tmp) throws IOException {
        Path file = Files.writeString(tmp.resolve("empty.ir.json"), "{ \"functions\": [] }");
        IrUnit unit = new IrJsonFrontend().load(file);
        assertEquals("empty.ir.json", unit.unit);
        assertTrue(unit.getFunctions().isEmpty());
    }

    @Test
    void missingJsonDocumentIsAFrontendError(@TempDir Path tmp) {
        assertThrows(IrFrontendException.class, () -> new IrJsonFrontend().load(tmp.resolve("absent.ir.json")));
    }

    @Test
    void malformedJsonDocumentIsAFrontendError(@TempDir Path tmp) throws IOException {
        Path file = Files.writeString(tmp.resolve("bad.ir.json"), "{ \"functions\": [ { \"name\": ");
        assertThrows(IrFrontendException.class, () -> new IrJsonFrontend().load(file));
    }

    @Test
    void emptyJsonDocumentIsAFrontendError(@TempDir Path tmp) throws IOException {
        Path file = Files.writeString(tmp.resolve("blank.ir.json"), "");
        assertThrows(IrFrontendException.class, () -> new IrJsonFrontend().load(file));
    }

    // --- Validation ---

    @Test
    void blockWithoutTerminatorIsRejected(@TempDir Path tmp) throws IOException {
        Path file = Files.writeString(tmp.resolve("x.ir.json"), """
                { "functions": [ { "name": "f", "blocks": [ { "id": 0, "statements": [] } ] } ] }
                """);
        IrFrontendException ex = assertThrows(IrFrontendException.class, () -> new IrJsonFrontend().load(file));
        assertTrue(ex.getMessage().contains("bb0"), ex.getMessage());
    }

    @Test
    void successorOutsideTheFunctionIsRejected(@TempDir Path tmp) throws IOException {
        Path file = Files.writeString(tmp.resolve("x.ir.json"), """
                { "functions": [ { "name": "f", "blocks": [
                  { "id": 0, "terminator": { "kind": "goto", "successors": [4] } }
                ] } ] }
                """);
        IrFrontendException ex = assertThrows(IrFrontendException.class, () -> new IrJsonFrontend().load(file));
        assertTrue(ex.getMessage().contains("bb4"), ex.getMessage());
    }

    @Test
    void duplicateBlockIdIsRejected(@TempDir Path tmp) throws IOException {
        Path file = Files.writeString(tmp.resolve("x.ir.json"), """
                { "functions": [ { "name": "f", "blocks": [
                  { "id": 0, "terminator": { "kind": "return" } },
                  { "id": 0, "terminator": { "kind": "return" } }
                ] } ] }
                """);
        assertThrows(IrFrontendException.class, () -> new IrJsonFrontend().load(file));
    }

    @Test
    void unnamedFunctionIsRejected(@TempDir Path tmp) throws IOException {
        Path file = Files.writeString(tmp.resolve("x.ir.json"), """
                { "functions": [ { "blocks": [] } ] }
                """);
        assertThrows(IrFrontendException.class, () -> new IrJsonFrontend().load(file));
    }

    @Test
    void unknownKindsLoadAsNull(@TempDir Path tmp) throws IOException {
        Path file = Files.writeString(tmp.resolve("x.ir.json"), """
                { "functions": [ { "name": "f", "blocks": [
                  { "id": 0, "terminator": { "kind": "yield", "successors": [] } }
                ] } ] }
                """);
        IrUnit unit = new IrJsonFrontend().load(file);
        assertNull(unit.getFunctions().get(0).getBlocks().get(0).terminator.kind);
    }

    // --- MIR dumps ---

    @Test
    void mirDumpLoadsThroughTheTextParser() {
        IrUnit unit = new MirFileFrontend().load(VAULT.resolve("mir/vault.mir"));
        assertEquals("vault.mir", unit.unit);
        assertEquals(3, unit.getFunctions().size());
    }

    @Test
    void missingMirDumpIsAFrontendError(@TempDir Path tmp) {
        assertThrows(IrFrontendException.class, () -> new MirFileFrontend().load(tmp.resolve("absent.mir")));
    }

    @Test
    void malformedMirDumpIsAFrontendError(@TempDir Path tmp) throws IOException {
        Path file = Files.writeString(tmp.resolve("bad.mir"), "fn f() -> () {\n    bb0: {\n");
        IrFrontendException ex = assertThrows(IrFrontendException.class, () -> new MirFileFrontend().load(file));
        assertInstanceOf(MirTextParser.MirParseException.class, ex.getCause());
    }
}
