package com.flowgraph.adapter.output;

import com.flowgraph.engine.cpg.EdgeKind;
import com.google.gson.annotations.SerializedName;

import java.util.ArrayList;
import java.util.List;

/**
 * POJOs for the structured CFG and CPG artifacts.
 * Field names use @SerializedName for JSON snake_case mapping.
 */
public final class GraphModel {

    private GraphModel() {}

    public static class CfgDocument {
        @SerializedName("function") public String function;
        @SerializedName("source")   public String source;
        @SerializedName("entry")    public int entry;
        @SerializedName("exit")     public int exit;
        @SerializedName("nodes")    public List<CfgNodeDto> nodes = new ArrayList<>();
        @SerializedName("edges")    public List<CfgEdgeDto> edges = new ArrayList<>();
    }

    public static class CfgNodeDto {
        @SerializedName("id")         public int id;
        @SerializedName("statements") public List<String> statements = new ArrayList<>();
    }

    public static class CfgEdgeDto {
        @SerializedName("from") public int from;
        @SerializedName("to")   public int to;
    }

    public static class CpgDocument {
        @SerializedName("function") public String function;
        @SerializedName("unit")     public String unit;
        @SerializedName("nodes")    public List<CpgNodeDto> nodes = new ArrayList<>();
        @SerializedName("edges")    public List<CpgEdgeDto> edges = new ArrayList<>();
    }

    public static class CpgNodeDto {
        @SerializedName("id")              public int id;
        @SerializedName("label")           public String label;
        @SerializedName("block")           public int block;
        @SerializedName("statement_index") public int statementIndex;
    }

    public static class CpgEdgeDto {
        @SerializedName("from") public int from;
        @SerializedName("to")   public int to;
        @SerializedName("kind") public EdgeKind kind;
    }
}
