package io.xfgslicer.classify;

import io.xfgslicer.model.KeyLineCategory;

/**
 * A node that matched a category but yielded no key line.
 *
 * @param nodeIndex Index of the node in the node table
 * @param category  Category the node matched
 * @param reason    Why no line was recorded
 */
public record DroppedCandidate(int nodeIndex, KeyLineCategory category, DropReason reason) {
}
