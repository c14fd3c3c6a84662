package io.xfgslicer.model;

/**
 * Risk categories a source line can be classified into.
 * Declaration order is the order slices are extracted and written in.
 */
public enum KeyLineCategory {
    CALL("call"),
    ARRAY("array"),
    PTR("ptr"),
    ARITH("arith");

    private final String wireName;

    KeyLineCategory(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Name used in output paths and JSON, e.g. {@code call}.
     */
    public String wireName() {
        return wireName;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
