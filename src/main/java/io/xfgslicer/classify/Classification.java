package io.xfgslicer.classify;

import io.xfgslicer.model.KeyLineSet;

import java.util.List;

/**
 * Result of classifying one node table.
 *
 * @param keyLines Key lines per category
 * @param dropped  Candidates that matched a category but could not be placed on a line
 */
public record Classification(KeyLineSet keyLines, List<DroppedCandidate> dropped) {

    public Classification {
        dropped = List.copyOf(dropped);
    }

    public long droppedFor(DropReason reason) {
        return dropped.stream().filter(d -> d.reason() == reason).count();
    }
}
