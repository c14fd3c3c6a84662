package io.xfgslicer.model;

/**
 * A line-level dependence edge.
 *
 * @param from Source line
 * @param to   Target line
 * @param kind Control or data dependence
 */
public record DependenceEdge(int from, int to, DependenceKind kind) {

    public DependenceEdge {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
    }

    public String formatted() {
        return from + " -" + kind.tag() + "-> " + to;
    }
}
