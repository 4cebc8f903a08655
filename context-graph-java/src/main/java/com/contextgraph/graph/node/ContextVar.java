package com.contextgraph.graph.node;

import com.contextgraph.graph.Loc;
import com.contextgraph.graph.NodeIdx;
import com.contextgraph.graph.range.SolcRange;

/**
 * One version of a variable or intermediate value.
 *
 * A version is never edited once published; writes go through
 * {@code VariableVersioning.advanceVar}, which clones into a new node. The range is the one
 * field installed after insertion, right after the clone is created.
 */
public class ContextVar implements Node {

    private final String name;
    private final String displayName;
    private final Loc loc;
    private final NodeIdx ty;
    private final TmpConstruction tmpOf;
    private SolcRange range;

    public ContextVar(String name, String displayName, Loc loc, NodeIdx ty, SolcRange range, TmpConstruction tmpOf) {
        this.name = name;
        this.displayName = displayName;
        this.loc = loc;
        this.ty = ty;
        this.range = range;
        this.tmpOf = tmpOf;
    }

    public static ContextVar named(String name, Loc loc, NodeIdx ty, SolcRange range) {
        return new ContextVar(name, name, loc, ty, range, null);
    }

    public static ContextVar tmp(String name, String displayName, Loc loc, NodeIdx ty, SolcRange range, TmpConstruction tmpOf) {
        return new ContextVar(name, displayName, loc, ty, range, tmpOf);
    }

    /** Copy of this version relocated to {@code newLoc}. */
    public ContextVar copyAt(Loc newLoc) {
        return new ContextVar(name, displayName, newLoc, ty, range, tmpOf);
    }

    public String getName() { return name; }
    public String getDisplayName() { return displayName; }
    public Loc getLoc() { return loc; }

    /** Index of the interned builtin type node, or null when the type is not a builtin. */
    public NodeIdx getTy() { return ty; }

    /** Null when the range is not known. */
    public SolcRange getRange() { return range; }

    public TmpConstruction getTmpOf() { return tmpOf; }

    public boolean isTmp() { return tmpOf != null; }

    void setRange(SolcRange range) {
        this.range = range;
    }

    @Override
    public String label() {
        return displayName + (range != null ? " " + range : "");
    }

    @Override
    public String toString() {
        return "ContextVar{name=" + name + ", loc=" + loc + ", range=" + range
                + (tmpOf != null ? ", tmpOf=" + tmpOf : "") + "}";
    }
}
