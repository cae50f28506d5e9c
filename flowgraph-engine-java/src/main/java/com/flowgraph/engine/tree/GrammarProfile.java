package com.flowgraph.engine.tree;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * The structural tags of one source grammar, as seen by the CFG builder and function discovery.
 *
 * A profile says which node kinds open a block, a conditional, a loop, a return or a break, which
 * child kinds fill the condition/consequence/alternative and loop-body slots, which kinds are
 * function definitions, which statement kinds only wrap an expression, and how everything else is
 * split into leaf statements and containers.
 */
public final class GrammarProfile {

    public static final String DEFAULT_FUNCTION_NAME = "unknown_function";

    private final String name;
    private final Set<String> blockKinds;
    private final Set<String> conditionalKinds;
    private final Set<String> conditionKinds;
    private final Set<String> consequenceKinds;
    private final Set<String> alternativeKinds;
    private final Set<String> returnKinds;
    private final Set<String> loopKinds;
    private final Set<String> loopBodyKinds;
    private final Set<String> breakKinds;
    private final Set<String> functionKinds;
    private final Set<String> functionBodyKinds;
    private final Set<String> statementWrapperKinds;
    private final String identifierKind;
    private final LeafStatementClassifier leafClassifier;

    private GrammarProfile(Builder b) {
        this.name = b.name;
        this.blockKinds = Set.copyOf(b.blockKinds);
        this.conditionalKinds = Set.copyOf(b.conditionalKinds);
        this.conditionKinds = Set.copyOf(b.conditionKinds);
        this.consequenceKinds = Set.copyOf(b.consequenceKinds);
        this.alternativeKinds = Set.copyOf(b.alternativeKinds);
        this.returnKinds = Set.copyOf(b.returnKinds);
        this.loopKinds = Set.copyOf(b.loopKinds);
        this.loopBodyKinds = Set.copyOf(b.loopBodyKinds);
        this.breakKinds = Set.copyOf(b.breakKinds);
        this.functionKinds = Set.copyOf(b.functionKinds);
        this.functionBodyKinds = Set.copyOf(b.functionBodyKinds);
        this.statementWrapperKinds = Set.copyOf(b.statementWrapperKinds);
        this.identifierKind = b.identifierKind;
        this.leafClassifier = b.leafClassifier != null
                ? b.leafClassifier
                : new SuffixLeafClassifier(List.of("_statement", "_declaration"));
    }

    // -----------------------------------------------------------------------
    // Built-in grammars
    // -----------------------------------------------------------------------

    /** tree-sitter-rust tags. */
    public static GrammarProfile rust() {
        return builder("rust")
                .blockKinds("block", "statement_block")
                .conditionalKinds("if_expression")
                .conditionKinds("condition", "let_condition", "let_chain", "binary_expression",
                        "unary_expression", "identifier", "call_expression", "field_expression",
                        "boolean_literal", "parenthesized_expression")
                .consequenceKinds("consequence", "block")
                .alternativeKinds("alternative", "else_clause")
                .returnKinds("return_expression")
                .loopKinds("loop_expression", "while_expression", "for_expression")
                .loopBodyKinds("block", "statement_block")
                .breakKinds("break_expression")
                .functionKinds("function_item")
                .functionBodyKinds("block", "statement_block")
                .identifierKind("identifier")
                .leafClassifier(new SuffixLeafClassifier(List.of("_statement", "_declaration", "_item")))
                .build();
    }

    /** tree-sitter JavaScript / TypeScript tags. */
    public static GrammarProfile javascript() {
        return builder("javascript")
                .blockKinds("statement_block")
                .conditionalKinds("if_statement")
                .conditionKinds("condition", "parenthesized_expression")
                .consequenceKinds("consequence", "statement_block", "expression_statement",
                        "return_statement", "break_statement")
                .alternativeKinds("alternative", "else_clause")
                .returnKinds("return_statement")
                .loopKinds("for_statement", "for_in_statement", "while_statement", "do_statement")
                .loopBodyKinds("statement_block")
                .breakKinds("break_statement")
                .functionKinds("function_declaration", "method_definition", "function")
                .functionBodyKinds("statement_block")
                .identifierKind("identifier")
                .leafClassifier(new SuffixLeafClassifier(List.of("_statement", "_declaration")))
                .build();
    }

    /** Tags emitted by the JDT-based Java parser of the adapter module. */
    public static GrammarProfile java() {
        return builder("java")
                .blockKinds("block")
                .conditionalKinds("if_statement")
                .conditionKinds("condition")
                .consequenceKinds("consequence")
                .alternativeKinds("alternative")
                .returnKinds("return_statement")
                .loopKinds("while_statement", "do_statement", "for_statement", "enhanced_for_statement")
                .loopBodyKinds("block")
                .breakKinds("break_statement")
                .functionKinds("method_declaration", "constructor_declaration")
                .functionBodyKinds("block")
                .identifierKind("identifier")
                .leafClassifier(new SuffixLeafClassifier(List.of("_statement", "_declaration")))
                .build();
    }

    /** Built-in profile by name ({@code rust}, {@code javascript}, {@code java}); null if unknown. */
    public static GrammarProfile named(String name) {
        if (name == null) return null;
        switch (name.toLowerCase(Locale.ROOT)) {
            case "rust":
                return rust();
            case "javascript":
                return javascript();
            case "java":
                return java();
            default:
                return null;
        }
    }

    /**
     * Built-in profile for a source file extension. Unknown extensions get the Rust profile,
     * which is the grammar the tag vocabulary was first written for.
     */
    public static GrammarProfile forExtension(String extension) {
        String ext = extension == null ? "" : extension.toLowerCase(Locale.ROOT);
        switch (ext) {
            case "java":
                return java();
            case "js":
            case "jsx":
            case "ts":
            case "tsx":
                return javascript();
            default:
                return rust();
        }
    }

    // -----------------------------------------------------------------------
    // Dispatch predicates
    // -----------------------------------------------------------------------

    public boolean isBlock(String kind)       { return blockKinds.contains(kind); }
    public boolean isConditional(String kind) { return conditionalKinds.contains(kind); }
    public boolean isReturn(String kind)      { return returnKinds.contains(kind); }
    public boolean isLoop(String kind)        { return loopKinds.contains(kind); }
    public boolean isBreak(String kind)       { return breakKinds.contains(kind); }
    public boolean isFunction(String kind)    { return functionKinds.contains(kind); }
    public boolean isLeafStatement(String kind) { return leafClassifier.isLeafStatement(kind); }
    public boolean isStatementWrapper(String kind) { return statementWrapperKinds.contains(kind); }

    /** True for the kinds the CFG builder gives their own control-flow treatment. */
    public boolean isStructural(String kind) {
        return isBlock(kind) || isConditional(kind) || isReturn(kind) || isLoop(kind) || isBreak(kind);
    }

    public String getName()                  { return name; }
    public Set<String> getConditionKinds()   { return conditionKinds; }
    public Set<String> getConsequenceKinds() { return consequenceKinds; }
    public Set<String> getAlternativeKinds() { return alternativeKinds; }
    public Set<String> getLoopBodyKinds()    { return loopBodyKinds; }
    public Set<String> getFunctionBodyKinds() { return functionBodyKinds; }
    public Set<String> getStatementWrapperKinds() { return statementWrapperKinds; }
    public String getIdentifierKind()        { return identifierKind; }
    public LeafStatementClassifier getLeafClassifier() { return leafClassifier; }

    @Override
    public String toString() {
        return "GrammarProfile[" + name + "]";
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /** A builder pre-filled with this profile's tags, for profiles that extend a built-in one. */
    public Builder toBuilder(String newName) {
        Builder b = new Builder(newName);
        b.blockKinds.addAll(blockKinds);
        b.conditionalKinds.addAll(conditionalKinds);
        b.conditionKinds.addAll(conditionKinds);
        b.consequenceKinds.addAll(consequenceKinds);
        b.alternativeKinds.addAll(alternativeKinds);
        b.returnKinds.addAll(returnKinds);
        b.loopKinds.addAll(loopKinds);
        b.loopBodyKinds.addAll(loopBodyKinds);
        b.breakKinds.addAll(breakKinds);
        b.functionKinds.addAll(functionKinds);
        b.functionBodyKinds.addAll(functionBodyKinds);
        b.statementWrapperKinds.addAll(statementWrapperKinds);
        b.identifierKind = identifierKind;
        b.leafClassifier = leafClassifier;
        return b;
    }

    public static final class Builder {
        private final String name;
        private final Set<String> blockKinds = new LinkedHashSet<>();
        private final Set<String> conditionalKinds = new LinkedHashSet<>();
        private final Set<String> conditionKinds = new LinkedHashSet<>();
        private final Set<String> consequenceKinds = new LinkedHashSet<>();
        private final Set<String> alternativeKinds = new LinkedHashSet<>();
        private final Set<String> returnKinds = new LinkedHashSet<>();
        private final Set<String> loopKinds = new LinkedHashSet<>();
        private final Set<String> loopBodyKinds = new LinkedHashSet<>();
        private final Set<String> breakKinds = new LinkedHashSet<>();
        private final Set<String> functionKinds = new LinkedHashSet<>();
        private final Set<String> functionBodyKinds = new LinkedHashSet<>();
        private final Set<String> statementWrapperKinds = new LinkedHashSet<>();
        private String identifierKind = "identifier";
        private LeafStatementClassifier leafClassifier;

        private Builder(String name) {
            this.name = name;
        }

        public Builder blockKinds(String... kinds)       { return add(blockKinds, kinds); }
        public Builder conditionalKinds(String... kinds) { return add(conditionalKinds, kinds); }
        public Builder conditionKinds(String... kinds)   { return add(conditionKinds, kinds); }
        public Builder consequenceKinds(String... kinds) { return add(consequenceKinds, kinds); }
        public Builder alternativeKinds(String... kinds) { return add(alternativeKinds, kinds); }
        public Builder returnKinds(String... kinds)      { return add(returnKinds, kinds); }
        public Builder loopKinds(String... kinds)        { return add(loopKinds, kinds); }
        public Builder loopBodyKinds(String... kinds)    { return add(loopBodyKinds, kinds); }
        public Builder breakKinds(String... kinds)       { return add(breakKinds, kinds); }
        public Builder functionKinds(String... kinds)    { return add(functionKinds, kinds); }
        public Builder functionBodyKinds(String... kinds) { return add(functionBodyKinds, kinds); }

        /**
         * Statement kinds that merely wrap an expression, e.g. tree-sitter-rust's
         * {@code expression_statement} around an {@code if_expression}. A wrapper whose child is
         * structural is replaced by that child instead of becoming a leaf line. No built-in
         * profile sets any: they keep the plain suffix classification.
         */
        public Builder statementWrapperKinds(String... kinds) { return add(statementWrapperKinds, kinds); }

        public Builder identifierKind(String kind) {
            this.identifierKind = kind;
            return this;
        }

        public Builder leafClassifier(LeafStatementClassifier classifier) {
            this.leafClassifier = classifier;
            return this;
        }

        private Builder add(Set<String> target, String... kinds) {
            for (String k : kinds) {
                if (k != null && !k.isEmpty()) target.add(k);
            }
            return this;
        }

        public GrammarProfile build() {
            return new GrammarProfile(this);
        }
    }
}
