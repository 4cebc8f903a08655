package com.contextgraph.builder.config;

import com.google.gson.annotations.SerializedName;

/**
 * Deserialized form of the builder configuration file. Every key is optional.
 */
public class BuilderConfig {

    @SerializedName("param_seeding")
    private ParamSeeding paramSeeding;

    /** Stop analysing further functions once one function reported a problem. */
    @SerializedName("stop_on_first_error")
    private Boolean stopOnFirstError;

    /** Write the finished graph as JSON into {@code output_dir}. */
    @SerializedName("export_graph")
    private Boolean exportGraph;

    @SerializedName("output_dir")
    private String outputDir;

    public BuilderConfig() {}

    public BuilderConfig(ParamSeeding paramSeeding, boolean stopOnFirstError) {
        this.paramSeeding = paramSeeding;
        this.stopOnFirstError = stopOnFirstError;
    }

    public BuilderConfig(ParamSeeding paramSeeding, boolean stopOnFirstError, String exportDir) {
        this(paramSeeding, stopOnFirstError);
        this.exportGraph = exportDir != null;
        this.outputDir = exportDir;
    }

    public static BuilderConfig defaults() {
        return new BuilderConfig();
    }

    public ParamSeeding getParamSeeding()  { return paramSeeding != null ? paramSeeding : ParamSeeding.FUNCTION_ENTRY; }
    public boolean isStopOnFirstError()    { return stopOnFirstError != null && stopOnFirstError; }
    public boolean isExportGraph()         { return exportGraph != null && exportGraph; }
    public String getOutputDir()           { return outputDir != null ? outputDir : "."; }
}
