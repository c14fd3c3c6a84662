package io.xfgslicer.manifest;

import java.util.*;

/**
 * Known vulnerable lines from a test-case manifest, keyed by test case id and file path.
 *
 * @param testCases testcase id -> (file path -> vulnerable lines)
 */
public record Manifest(Map<String, Map<String, Set<Integer>>> testCases) {

    public Manifest {
        Map<String, Map<String, Set<Integer>>> copy = new LinkedHashMap<>();
        testCases.forEach((id, files) -> {
            Map<String, Set<Integer>> filesCopy = new LinkedHashMap<>();
            files.forEach((path, lines) -> filesCopy.put(path, Set.copyOf(lines)));
            copy.put(id, Collections.unmodifiableMap(filesCopy));
        });
        testCases = Collections.unmodifiableMap(copy);
    }

    public static Manifest empty() {
        return new Manifest(Map.of());
    }

    /**
     * Vulnerable lines of a file across all test cases that list it.
     * Paths are compared after normalizing separators to {@code /}.
     */
    public Set<Integer> vulnerableLines(String filePath) {
        String wanted = normalize(filePath);
        Set<Integer> lines = new TreeSet<>();
        for (Map<String, Set<Integer>> files : testCases.values()) {
            files.forEach((path, fileLines) -> {
                if (normalize(path).equals(wanted)) {
                    lines.addAll(fileLines);
                }
            });
        }
        return lines;
    }

    /**
     * Whether the manifest lists the file at all, vulnerable or not.
     */
    public boolean covers(String filePath) {
        String wanted = normalize(filePath);
        return testCases.values().stream()
                .flatMap(files -> files.keySet().stream())
                .anyMatch(path -> normalize(path).equals(wanted));
    }

    public int testCaseCount() {
        return testCases.size();
    }

    private static String normalize(String path) {
        String p = path.replace('\\', '/');
        while (p.startsWith("./")) {
            p = p.substring(2);
        }
        return p;
    }
}
