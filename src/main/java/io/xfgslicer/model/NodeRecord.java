package io.xfgslicer.model;

import java.util.Map;

/**
 * One row of the node table.
 *
 * @param type     AST node type, e.g. {@code CallExpression} or {@code ArrayIndexing}
 * @param code     Source fragment (may be empty)
 * @param location {@code line:column:offset:end} text, empty when the extractor emitted none
 * @param operator Operator symbol for expression nodes (may be empty)
 * @param key      Node identifier referenced by the edge table
 */
public record NodeRecord(
        String type,
        String code,
        String location,
        String operator,
        String key
) {
    public NodeRecord {
        type = normalize(type);
        code = normalize(code);
        location = normalize(location);
        operator = normalize(operator);
        key = normalize(key);
    }

    /**
     * Builds a node from a loaded table row. Missing columns read as empty.
     */
    public static NodeRecord fromRow(Map<String, String> row) {
        return new NodeRecord(
                row.get("type"),
                row.get("code"),
                row.get("location"),
                row.get("operator"),
                row.get("key")
        );
    }

    public boolean hasLocation() {
        return !location.isEmpty();
    }

    private static String normalize(String value) {
        return value == null ? "" : value.strip();
    }
}
