package com.flowgraph.adapter.output;

import java.util.HashSet;
import java.util.Set;

/**
 * Turns function names into file-name-safe, unique artifact stems within one unit.
 * A repeated name gets {@code _2}, {@code _3}, ... appended.
 */
public class ArtifactNamer {

    private final Set<String> used = new HashSet<>();

    public String uniqueStem(String functionName) {
        String base = sanitize(functionName);
        String stem = base;
        for (int n = 2; !used.add(stem); n++) {
            stem = base + "_" + n;
        }
        return stem;
    }

    /** Keeps letters, digits, {@code _}, {@code -} and {@code .}; everything else becomes {@code _}. */
    public static String sanitize(String name) {
        if (name == null || name.isBlank()) return "unknown_function";
        StringBuilder sb = new StringBuilder(name.length());
        for (char c : name.trim().toCharArray()) {
            boolean safe = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
                    || c == '_' || c == '-' || c == '.';
            sb.append(safe ? c : '_');
        }
        return sb.toString();
    }
}
