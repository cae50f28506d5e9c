package com.flowgraph.adapter.config;

import com.flowgraph.engine.tree.GrammarProfile;
import com.google.gson.annotations.SerializedName;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Deserialized form of the optional pipeline configuration file.
 * Every key may be omitted; getters fall back to the defaults.
 */
public class PipelineConfig {

    @SerializedName("source_extensions")
    private List<String> sourceExtensions;

    @SerializedName("ast_suffix")
    private String astSuffix;

    @SerializedName("cfg_input_suffix")
    private String cfgInputSuffix;

    /** Extra grammar profiles keyed by source file extension. */
    @SerializedName("profiles")
    private Map<String, ProfileConfig> profiles;

    @SerializedName("rustc")
    private String rustc;

    /** Target triple for the compiler; null means the host target. */
    @SerializedName("target")
    private String target;

    @SerializedName("cfg_flags")
    private List<String> cfgFlags;

    @SerializedName("crate_type")
    private String crateType;

    @SerializedName("extra_compiler_args")
    private List<String> extraCompilerArgs;

    @SerializedName("write_dot")
    private Boolean writeDot;

    @SerializedName("write_json")
    private Boolean writeJson;

    public static PipelineConfig defaults() {
        return new PipelineConfig();
    }

    public List<String> getSourceExtensions() {
        return sourceExtensions != null ? sourceExtensions : List.of("java");
    }
    public String getAstSuffix()         { return astSuffix != null ? astSuffix : ".ast.json"; }
    public String getCfgInputSuffix()    { return cfgInputSuffix != null ? cfgInputSuffix : ".ast.json"; }
    public Map<String, ProfileConfig> getProfiles() {
        return profiles != null ? profiles : Collections.emptyMap();
    }
    public String getRustc()             { return rustc != null ? rustc : "rustc"; }
    public String getTarget()            { return target; }
    public List<String> getCfgFlags() {
        return cfgFlags != null ? cfgFlags : List.of("feature=\"no-entrypoint\"");
    }
    public String getCrateType()         { return crateType != null ? crateType : "lib"; }
    public List<String> getExtraCompilerArgs() {
        return extraCompilerArgs != null ? extraCompilerArgs : Collections.emptyList();
    }
    public boolean isWriteDot()          { return writeDot == null || writeDot; }
    public boolean isWriteJson()         { return writeJson == null || writeJson; }

    void setProfiles(Map<String, ProfileConfig> profiles) { this.profiles = profiles; }

    // Command-line overrides
    public void setTarget(String target)           { this.target = target; }
    public void setCfgFlags(List<String> cfgFlags) { this.cfgFlags = List.copyOf(cfgFlags); }

    /**
     * Grammar profile for a source extension: a configured profile wins over the built-in one.
     */
    public GrammarProfile profileFor(String extension) {
        String ext = extension == null ? "" : extension.toLowerCase(Locale.ROOT);
        ProfileConfig configured = getProfiles().get(ext);
        if (configured != null) {
            return configured.toGrammarProfile(ext);
        }
        return GrammarProfile.forExtension(ext);
    }

    public boolean isSourceExtension(String extension) {
        for (String ext : getSourceExtensions()) {
            if (ext.equalsIgnoreCase(extension)) return true;
        }
        return false;
    }
}
