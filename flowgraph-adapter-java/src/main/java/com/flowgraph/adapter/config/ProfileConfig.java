package com.flowgraph.adapter.config;

import com.flowgraph.engine.tree.GrammarProfile;
import com.flowgraph.engine.tree.SuffixLeafClassifier;
import com.google.gson.annotations.SerializedName;

import java.util.Collections;
import java.util.List;

/**
 * A grammar profile declared in the configuration file, for parsers whose tags
 * the built-in profiles do not know. With {@code base} set, the listed kinds are
 * added to that built-in profile instead of starting from an empty one.
 */
public class ProfileConfig {

    @SerializedName("name")               private String name;
    @SerializedName("base")               private String base;
    @SerializedName("block_kinds")        private List<String> blockKinds;
    @SerializedName("conditional_kinds")  private List<String> conditionalKinds;
    @SerializedName("condition_kinds")    private List<String> conditionKinds;
    @SerializedName("consequence_kinds")  private List<String> consequenceKinds;
    @SerializedName("alternative_kinds")  private List<String> alternativeKinds;
    @SerializedName("return_kinds")       private List<String> returnKinds;
    @SerializedName("loop_kinds")         private List<String> loopKinds;
    @SerializedName("loop_body_kinds")    private List<String> loopBodyKinds;
    @SerializedName("break_kinds")        private List<String> breakKinds;
    @SerializedName("function_kinds")     private List<String> functionKinds;
    @SerializedName("function_body_kinds") private List<String> functionBodyKinds;
    @SerializedName("statement_wrapper_kinds") private List<String> statementWrapperKinds;
    @SerializedName("identifier_kind")    private String identifierKind;
    @SerializedName("leaf_suffixes")      private List<String> leafSuffixes;

    public GrammarProfile toGrammarProfile(String extension) {
        String profileName = name != null ? name : extension;
        GrammarProfile baseProfile = GrammarProfile.named(base);
        GrammarProfile.Builder builder = (baseProfile != null
                ? baseProfile.toBuilder(profileName)
                : GrammarProfile.builder(profileName))
                .blockKinds(array(blockKinds))
                .conditionalKinds(array(conditionalKinds))
                .conditionKinds(array(conditionKinds))
                .consequenceKinds(array(consequenceKinds))
                .alternativeKinds(array(alternativeKinds))
                .returnKinds(array(returnKinds))
                .loopKinds(array(loopKinds))
                .loopBodyKinds(array(loopBodyKinds))
                .breakKinds(array(breakKinds))
                .functionKinds(array(functionKinds))
                .functionBodyKinds(array(functionBodyKinds))
                .statementWrapperKinds(array(statementWrapperKinds));
        if (identifierKind != null) {
            builder.identifierKind(identifierKind);
        }
        if (leafSuffixes != null && !leafSuffixes.isEmpty()) {
            builder.leafClassifier(new SuffixLeafClassifier(leafSuffixes));
        }
        return builder.build();
    }

    public String getBase() { return base; }

    boolean declaresFunctionKinds() {
        return functionKinds != null && !functionKinds.isEmpty();
    }

    private static String[] array(List<String> kinds) {
        return (kinds != null ? kinds : Collections.<String>emptyList()).toArray(new String[0]);
    }
}
