package io.xfgslicer.classify;

import io.xfgslicer.model.NodeRecord;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Maps nodes of the node table to source line numbers.
 * <p>
 * A node's line is the first component of its {@code location} field. Nodes without a
 * usable location inherit the line of the nearest preceding node (by table index) that has
 * one, since the extractor emits sub-expression nodes right after the statement they belong to.
 */
public final class LineResolver {

    private LineResolver() {
    }

    /**
     * Resolves the line of the node at {@code index}, walking backward if needed. The walk
     * stops at the first readable location; if its line is not positive the node has no line.
     */
    public static LineResolution resolve(List<NodeRecord> nodes, int index) {
        if (index < 0 || index >= nodes.size()) {
            throw new IndexOutOfBoundsException("node index " + index + " out of range 0.." + nodes.size());
        }

        boolean sawMalformed = false;
        for (int i = index; i >= 0; i--) {
            NodeRecord node = nodes.get(i);
            if (!node.hasLocation()) {
                continue;
            }
            OptionalInt line = parseLine(node.location());
            if (line.isEmpty()) {
                sawMalformed = true;
                continue;
            }
            if (line.getAsInt() <= 0) {
                return LineResolution.unresolved(DropReason.NO_LOCATION);
            }
            return LineResolution.resolved(line.getAsInt(), i);
        }
        return LineResolution.unresolved(sawMalformed ? DropReason.MALFORMED_LOCATION : DropReason.NO_LOCATION);
    }

    /**
     * Maps each node key to the line in its own location. Nodes without a readable
     * location are left out; no backward walk is done here. Line 0 is kept, so graph
     * edges touching such nodes survive even though they never make a key line.
     */
    public static Map<String, Integer> nodeIdToLine(List<NodeRecord> nodes) {
        Map<String, Integer> result = new HashMap<>();
        for (NodeRecord node : nodes) {
            if (!node.hasLocation()) {
                continue;
            }
            OptionalInt line = parseLine(node.location());
            if (line.isPresent()) {
                result.put(node.key(), line.getAsInt());
            }
        }
        return Collections.unmodifiableMap(result);
    }

    /**
     * Reads the line part of a {@code line:column[:...]} location.
     */
    static OptionalInt parseLine(String location) {
        if (location == null || location.isBlank()) {
            return OptionalInt.empty();
        }
        String text = location.strip();
        int colon = text.indexOf(':');
        String linePart = colon >= 0 ? text.substring(0, colon) : text;
        try {
            return OptionalInt.of(Integer.parseInt(linePart.strip()));
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }
}
