package com.contextgraph.graph;

/**
 * Typed failure raised while building or querying the context graph.
 * No caller in this project terminates the process on one of these; see {@link #isRecoverable()}.
 */
public class IrException extends RuntimeException {

    public enum Kind {
        /** A lookup expected one node kind and found another. */
        NODE_KIND_MISMATCH(false),
        /** A context has no owning function reachable through {@code CONTEXT} edges. */
        MISSING_ENCLOSING_FUNCTION(false),
        /** A statement or expression kind that has no semantics yet. */
        UNSUPPORTED_CONSTRUCT(true),
        /** An expression that had to produce a value produced none. */
        EMPTY_EVALUATION_RESULT(true),
        /** An identifier naming neither a visible variable nor a known function. */
        UNRESOLVED_IDENTIFIER(true),
        /** A write targeted a variable version that already has a successor. */
        STALE_VERSION_WRITE(false);

        private final boolean recoverable;

        Kind(boolean recoverable) {
            this.recoverable = recoverable;
        }

        public boolean isRecoverable() {
            return recoverable;
        }
    }

    private final Kind kind;
    private final Loc loc;

    public IrException(Kind kind, Loc loc, String message) {
        super(message);
        this.kind = kind;
        this.loc = loc;
    }

    public Kind getKind() { return kind; }

    /** Location of the offending construct, or {@code null} when the failure has none. */
    public Loc getLoc() { return loc; }

    public boolean isRecoverable() { return kind.isRecoverable(); }

    public static IrException nodeKindMismatch(NodeIdx idx, String expected, Object found) {
        return new IrException(Kind.NODE_KIND_MISMATCH, null,
                "Node type confusion at " + idx + ": expected " + expected + " but found " + found);
    }

    public static IrException missingEnclosingFunction(NodeIdx ctx) {
        return new IrException(Kind.MISSING_ENCLOSING_FUNCTION, null,
                "No associated function for context " + ctx);
    }

    public static IrException unsupported(String construct, Loc loc) {
        return new IrException(Kind.UNSUPPORTED_CONSTRUCT, loc,
                "Unsupported construct '" + construct + "' at " + loc);
    }

    public static IrException emptyResult(String what, Loc loc) {
        return new IrException(Kind.EMPTY_EVALUATION_RESULT, loc,
                "Expected " + what + " to yield a value at " + loc + " but it yielded none");
    }

    public static IrException unresolved(String name, Loc loc) {
        return new IrException(Kind.UNRESOLVED_IDENTIFIER, loc,
                "Unresolved identifier '" + name + "' at " + loc);
    }

    public static IrException staleWrite(NodeIdx version, NodeIdx successor, Loc loc) {
        return new IrException(Kind.STALE_VERSION_WRITE, loc,
                "Cannot write to " + version + " at " + loc + ": already superseded by " + successor);
    }
}
