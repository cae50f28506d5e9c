package com.flowgraph.adapter.output;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ArtifactNamerTest {

    @Test
    void repeatedNamesGetNumericSuffixes() {
        ArtifactNamer namer = new ArtifactNamer();
        assertEquals("process", namer.uniqueStem("process"));
        assertEquals("process_2", namer.uniqueStem("process"));
        assertEquals("process_3", namer.uniqueStem("process"));
        assertEquals("other", namer.uniqueStem("other"));
    }

    @Test
    void suffixNeverCollidesWithALiteralName() {
        ArtifactNamer namer = new ArtifactNamer();
        assertEquals("f", namer.uniqueStem("f"));
        assertEquals("f_2", namer.uniqueStem("f"));
        assertEquals("f_2_2", namer.uniqueStem("f_2"));
    }

    @Test
    void unsafeCharactersAreReplaced() {
        assertEquals("_impl_Vault___deposit", ArtifactNamer.sanitize("<impl Vault>::deposit"));
        assertEquals("a.b-c_d", ArtifactNamer.sanitize("a.b-c_d"));
        assertEquals("unknown_function", ArtifactNamer.sanitize("  "));
        assertEquals("unknown_function", ArtifactNamer.sanitize(null));
    }

    @Test
    void namersAreIndependentPerUnit() {
        assertEquals("f", new ArtifactNamer().uniqueStem("f"));
        assertEquals("f", new ArtifactNamer().uniqueStem("f"));
    }
}
