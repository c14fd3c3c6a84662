package io.xfgslicer.classify;

/**
 * Outcome of resolving a node to a source line.
 *
 * @param line        Resolved line, or -1 when unresolved
 * @param sourceIndex Index of the node whose location supplied the line, or -1
 * @param reason      Why resolution failed, null when resolved
 */
public record LineResolution(int line, int sourceIndex, DropReason reason) {

    public static LineResolution resolved(int line, int sourceIndex) {
        return new LineResolution(line, sourceIndex, null);
    }

    public static LineResolution unresolved(DropReason reason) {
        return new LineResolution(-1, -1, reason);
    }

    public boolean isResolved() {
        return reason == null;
    }
}
