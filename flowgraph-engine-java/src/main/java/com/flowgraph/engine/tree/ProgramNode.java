package com.flowgraph.engine.tree;

import com.google.gson.annotations.SerializedName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * One node of a parsed program: a structural tag, the source text it spans, and its ordered children.
 *
 * Field names match the JSON dump written by the AST stage (and by tree-sitter based dumpers),
 * so instances are loaded directly with Gson. Instances are never mutated after construction.
 */
public final class ProgramNode {

    @SerializedName("kind")       private final String kind;
    @SerializedName("text")       private final String text;
    @SerializedName("start_byte") private final Integer startByte;  // nullable
    @SerializedName("end_byte")   private final Integer endByte;    // nullable
    @SerializedName("children")   private final List<ProgramNode> children;

    public ProgramNode(String kind, String text, List<ProgramNode> children) {
        this(kind, text, null, null, children);
    }

    public ProgramNode(String kind, String text, Integer startByte, Integer endByte, List<ProgramNode> children) {
        this.kind = kind;
        this.text = text;
        this.startByte = startByte;
        this.endByte = endByte;
        this.children = children != null ? new ArrayList<>(children) : new ArrayList<>();
    }

    public static ProgramNode leaf(String kind, String text) {
        return new ProgramNode(kind, text, Collections.emptyList());
    }

    public static ProgramNode of(String kind, String text, ProgramNode... children) {
        return new ProgramNode(kind, text, List.of(children));
    }

    public String getKind()        { return kind != null ? kind : ""; }
    public String getText()        { return text != null ? text : ""; }
    public Integer getStartByte()  { return startByte; }
    public Integer getEndByte()    { return endByte; }

    // Gson bypasses the constructor, so a missing "children" key leaves the field null.
    public List<ProgramNode> getChildren() {
        return children != null ? Collections.unmodifiableList(children) : Collections.emptyList();
    }

    /** First direct child whose kind is in {@code kinds}, or null. */
    public ProgramNode firstChildOfKind(Set<String> kinds) {
        for (ProgramNode child : getChildren()) {
            if (kinds.contains(child.getKind())) return child;
        }
        return null;
    }

    /** First line of the node's text, trimmed. */
    public String firstLine() {
        String t = getText();
        int nl = t.indexOf('\n');
        String line = nl >= 0 ? t.substring(0, nl) : t;
        return line.trim();
    }

    @Override
    public String toString() {
        return kind + "[" + getChildren().size() + " children]";
    }
}
