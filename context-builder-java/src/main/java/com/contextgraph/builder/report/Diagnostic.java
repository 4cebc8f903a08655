package com.contextgraph.builder.report;

import com.contextgraph.graph.IrException;
import com.contextgraph.graph.Loc;

/**
 * One problem met while building, kept so the rest of the pass can carry on.
 */
public record Diagnostic(IrException.Kind kind, Loc loc, String message) {

    public static Diagnostic of(IrException e) {
        return new Diagnostic(e.getKind(), e.getLoc(), e.getMessage());
    }

    @Override
    public String toString() {
        return kind + " at " + loc + ": " + message;
    }
}
