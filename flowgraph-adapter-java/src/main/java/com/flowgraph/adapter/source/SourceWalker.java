package com.flowgraph.adapter.source;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lists the regular files under a root in sorted order, so runs over the same tree
 * process units in the same order.
 */
public class SourceWalker {

    public List<Path> walk(Path root, Predicate<Path> accept) {
        try (Stream<Path> walk = Files.walk(root)) {
            return walk
                .filter(Files::isRegularFile)
                .filter(accept)
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Could not walk " + root + ": " + e.getMessage(), e);
        }
    }

    /** Extension of a file name without the dot, or "" when there is none. */
    public static String extensionOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 && dot < fileName.length() - 1 ? fileName.substring(dot + 1) : "";
    }
}
