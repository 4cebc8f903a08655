package com.contextgraph.builder.context;

import com.contextgraph.graph.NodeIdx;

/**
 * Where a statement is being built: the parent node (a function or an enclosing context, or
 * null) and whether arithmetic is unchecked at this point.
 */
record BuildFrame(NodeIdx parent, boolean unchecked) {}
