package com.contextgraph.builder.export;

import com.google.gson.annotations.SerializedName;
import java.util.List;

/**
 * POJOs of the exported graph document.
 * Field names use @SerializedName for JSON snake_case mapping.
 */
public final class GraphModel {

    private GraphModel() {}

    public static class GraphRoot {
        @SerializedName("format_version") public String formatVersion;
        @SerializedName("node_count")     public int nodeCount;
        @SerializedName("edge_count")     public int edgeCount;
        @SerializedName("nodes")          public List<GraphNode> nodes;
        @SerializedName("edges")          public List<GraphEdgeEntry> edges;
    }

    public static class GraphNode {
        @SerializedName("index") public int index;
        @SerializedName("kind")  public String kind;     // Function, Context, ContextVar, ...
        @SerializedName("label") public String label;
        @SerializedName("loc")   public String loc;      // nullable
        @SerializedName("range") public String range;    // nullable; value range of a ContextVar, natural range of a numeric Builtin
        @SerializedName("type")  public Integer type;    // nullable, index of the builtin node
    }

    public static class GraphEdgeEntry {
        @SerializedName("source") public int source;
        @SerializedName("target") public int target;
        @SerializedName("kind")   public String kind;
    }
}
