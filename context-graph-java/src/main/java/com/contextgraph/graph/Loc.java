package com.contextgraph.graph;

/**
 * Source span inside one file of the analysed source unit.
 * Offsets are byte offsets as reported by the parser.
 */
public record Loc(int file, int start, int end) {

    public static final Loc IMPLICIT = new Loc(-1, 0, 0);

    public static Loc of(int file, int start, int end) {
        return new Loc(file, start, end);
    }

    @Override
    public String toString() {
        if (file < 0) return "<implicit>";
        return file + ":" + start + "-" + end;
    }
}
