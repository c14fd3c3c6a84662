package io.xfgslicer.model;

import java.util.Map;

/**
 * One row of the edge table.
 *
 * @param start Source node identifier
 * @param end   Target node identifier
 * @param type  Edge type, e.g. {@code CONTROLS} or {@code REACHES}
 */
public record EdgeRecord(
        String start,
        String end,
        String type
) {
    public EdgeRecord {
        start = start == null ? "" : start.strip();
        end = end == null ? "" : end.strip();
        type = type == null ? "" : type.strip();
    }

    public static EdgeRecord fromRow(Map<String, String> row) {
        return new EdgeRecord(row.get("start"), row.get("end"), row.get("type"));
    }
}
