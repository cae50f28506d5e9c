package com.flowgraph.adapter.source;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourceWalkerTest {

    @Test
    void walksRecursivelyInSortedOrder(@TempDir Path tmp) throws IOException {
        Files.createDirectories(tmp.resolve("b/c"));
        Files.writeString(tmp.resolve("b/c/Z.java"), "");
        Files.writeString(tmp.resolve("b/A.java"), "");
        Files.writeString(tmp.resolve("notes.txt"), "");

        List<Path> files = new SourceWalker().walk(tmp, p -> p.toString().endsWith(".java"));
        assertEquals(List.of(tmp.resolve("b/A.java"), tmp.resolve("b/c/Z.java")), files);
    }

    @Test
    void missingRootThrowsUncheckedIOException(@TempDir Path tmp) {
        assertThrows(UncheckedIOException.class, () -> new SourceWalker().walk(tmp.resolve("nope"), p -> true));
    }

    @Test
    void extensionOfHandlesEdgeCases() {
        assertEquals("rs", SourceWalker.extensionOf("lib.rs"));
        assertEquals("json", SourceWalker.extensionOf("lib.rs.ast.json"));
        assertEquals("", SourceWalker.extensionOf("Makefile"));
        assertEquals("", SourceWalker.extensionOf(".gitignore"));
        assertEquals("", SourceWalker.extensionOf("trailing."));
    }
}
