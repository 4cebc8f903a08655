package com.contextgraph.builder.config;

import com.google.gson.annotations.SerializedName;

/**
 * Which new scopes receive fresh versions of the enclosing function's parameters and named
 * returns.
 */
public enum ParamSeeding {
    /** Only the function's top-level body scope. Nested blocks see them through the scope chain. */
    @SerializedName("function_entry")
    FUNCTION_ENTRY,

    /** Every block scope, nested ones included, gets its own independent copies. */
    @SerializedName("every_block")
    EVERY_BLOCK
}
