package io.xfgslicer.graph;

/**
 * Why no dependence graph was built for a file. None of these is an error: the file
 * simply has nothing to slice.
 */
public enum NoGraphReason {
    /** The extractor wrote no node or no edge table for the file. */
    TABLES_ABSENT,
    /** The node table has a header but no rows. */
    NO_NODES
}
