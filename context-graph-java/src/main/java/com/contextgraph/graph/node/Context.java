package com.contextgraph.graph.node;

import com.contextgraph.graph.Loc;

/**
 * One lexical scope. The temporary-id counter only ever grows.
 */
public class Context implements Node {

    private final Loc loc;
    private final boolean unchecked;
    private int tmpVarCtr;

    public Context(Loc loc, boolean unchecked) {
        this.loc = loc;
        this.unchecked = unchecked;
    }

    public Loc getLoc() { return loc; }

    /** Arithmetic in this scope (or an enclosing one) was declared {@code unchecked}. */
    public boolean isUnchecked() { return unchecked; }

    public int getTmpVarCtr() { return tmpVarCtr; }

    /** Returns the current counter value, then increments it. */
    int nextTmp() {
        return tmpVarCtr++;
    }

    @Override
    public String label() {
        return "context @" + loc;
    }

    @Override
    public String toString() {
        return "Context{loc=" + loc + ", unchecked=" + unchecked + ", tmpVarCtr=" + tmpVarCtr + "}";
    }
}
