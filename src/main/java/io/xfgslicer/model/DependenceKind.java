package io.xfgslicer.model;

/**
 * Kind of a dependence edge between two source lines.
 */
public enum DependenceKind {
    /** Execution of the target line is governed by the source line. */
    CONTROL("c", "CONTROLS"),
    /** A value defined at the source line may reach the target line. */
    DATA("d", "REACHES");

    private final String tag;
    private final String edgeType;

    DependenceKind(String tag, String edgeType) {
        this.tag = tag;
        this.edgeType = edgeType;
    }

    /**
     * Short tag written to output ({@code c} or {@code d}).
     */
    public String tag() {
        return tag;
    }

    /**
     * Maps an edge table type to a dependence kind. Other edge types
     * (AST, CFG, ...) carry no dependence and map to null.
     */
    public static DependenceKind forEdgeType(String edgeType) {
        for (DependenceKind kind : values()) {
            if (kind.edgeType.equals(edgeType)) {
                return kind;
            }
        }
        return null;
    }
}
