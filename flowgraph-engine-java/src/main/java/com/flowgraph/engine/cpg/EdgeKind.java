package com.flowgraph.engine.cpg;

import com.google.gson.annotations.SerializedName;

public enum EdgeKind {
    @SerializedName("control_flow") CONTROL_FLOW("CFG"),
    @SerializedName("data_flow")    DATA_FLOW("DFG");

    private final String shortName;

    EdgeKind(String shortName) {
        this.shortName = shortName;
    }

    public String shortName() {
        return shortName;
    }
}
