package io.xfgslicer.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Key lines of one source file, grouped by risk category.
 * <p>
 * A line may belong to several categories; within a category each line appears once.
 * Every category is present, possibly with an empty set.
 */
public final class KeyLineSet {

    private final Map<KeyLineCategory, SortedSet<Integer>> lines;

    private KeyLineSet(Map<KeyLineCategory, SortedSet<Integer>> lines) {
        Map<KeyLineCategory, SortedSet<Integer>> copy = new EnumMap<>(KeyLineCategory.class);
        for (KeyLineCategory category : KeyLineCategory.values()) {
            SortedSet<Integer> set = lines.getOrDefault(category, Collections.emptySortedSet());
            copy.put(category, Collections.unmodifiableSortedSet(new TreeSet<>(set)));
        }
        this.lines = Collections.unmodifiableMap(copy);
    }

    public static KeyLineSet empty() {
        return new KeyLineSet(Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Lines of the given category in ascending order.
     */
    public SortedSet<Integer> lines(KeyLineCategory category) {
        return lines.get(category);
    }

    /**
     * Number of (category, line) pairs, counting a line once per category.
     */
    public int size() {
        return lines.values().stream().mapToInt(SortedSet::size).sum();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof KeyLineSet other)) return false;
        return lines.equals(other.lines);
    }

    @Override
    public int hashCode() {
        return lines.hashCode();
    }

    @Override
    public String toString() {
        return "KeyLineSet" + lines;
    }

    public static class Builder {
        private final Map<KeyLineCategory, SortedSet<Integer>> lines = new EnumMap<>(KeyLineCategory.class);

        public Builder add(KeyLineCategory category, int line) {
            lines.computeIfAbsent(category, k -> new TreeSet<>()).add(line);
            return this;
        }

        public KeyLineSet build() {
            return new KeyLineSet(lines);
        }
    }
}
