package io.xfgslicer.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * All slices extracted from one source file, grouped by category.
 * Every category is present; a file may contribute zero slices to any of them.
 */
public final class FileSlices {

    private final String sourceFile;
    private final Map<KeyLineCategory, List<CodeSlice>> slices;

    public FileSlices(String sourceFile, Map<KeyLineCategory, List<CodeSlice>> slices) {
        this.sourceFile = sourceFile;
        Map<KeyLineCategory, List<CodeSlice>> copy = new EnumMap<>(KeyLineCategory.class);
        for (KeyLineCategory category : KeyLineCategory.values()) {
            copy.put(category, List.copyOf(slices.getOrDefault(category, List.of())));
        }
        this.slices = Collections.unmodifiableMap(copy);
    }

    public static FileSlices empty(String sourceFile) {
        return new FileSlices(sourceFile, Map.of());
    }

    public String sourceFile() {
        return sourceFile;
    }

    public List<CodeSlice> slices(KeyLineCategory category) {
        return slices.get(category);
    }

    public Map<KeyLineCategory, List<CodeSlice>> byCategory() {
        return slices;
    }

    /**
     * All slices, in category order then key line order.
     */
    public List<CodeSlice> allSlices() {
        List<CodeSlice> all = new ArrayList<>();
        slices.values().forEach(all::addAll);
        return all;
    }

    public int totalSlices() {
        return slices.values().stream().mapToInt(List::size).sum();
    }

    public boolean isEmpty() {
        return totalSlices() == 0;
    }

    /**
     * Returns a copy with every slice replaced by {@code mapper.apply(slice)}.
     */
    public FileSlices map(UnaryOperator<CodeSlice> mapper) {
        Map<KeyLineCategory, List<CodeSlice>> mapped = new EnumMap<>(KeyLineCategory.class);
        slices.forEach((category, list) -> mapped.put(category, list.stream().map(mapper).toList()));
        return new FileSlices(sourceFile, mapped);
    }
}
