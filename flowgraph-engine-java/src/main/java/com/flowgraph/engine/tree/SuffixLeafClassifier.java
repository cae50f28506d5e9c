package com.flowgraph.engine.tree;

import java.util.List;

/**
 * Classifies a tag as a leaf statement when it ends with one of the configured suffixes,
 * e.g. {@code _statement}, {@code _declaration}, {@code _item}.
 */
public class SuffixLeafClassifier implements LeafStatementClassifier {

    private final List<String> suffixes;

    public SuffixLeafClassifier(List<String> suffixes) {
        this.suffixes = List.copyOf(suffixes);
    }

    @Override
    public boolean isLeafStatement(String kind) {
        for (String suffix : suffixes) {
            if (kind.endsWith(suffix)) return true;
        }
        return false;
    }

    public List<String> getSuffixes() { return suffixes; }
}
