package io.xfgslicer.classify;

import io.xfgslicer.ConfigurationException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Names of library functions whose call sites count as key lines, e.g. {@code strcpy}.
 * Loaded from a comma-separated text file.
 */
public final class SensitiveApiList {

    private final Set<String> names;

    private SensitiveApiList(Set<String> names) {
        this.names = Set.copyOf(names);
    }

    public static SensitiveApiList of(Collection<String> names) {
        Set<String> cleaned = new LinkedHashSet<>();
        for (String name : names) {
            if (name != null && !name.isBlank()) {
                cleaned.add(name.strip());
            }
        }
        return new SensitiveApiList(cleaned);
    }

    /**
     * Parses comma-separated names, trimming whitespace and skipping blank entries.
     */
    public static SensitiveApiList parse(String text) {
        return of(Arrays.asList(text.split(",")));
    }

    /**
     * Loads the list from a file.
     *
     * @throws ConfigurationException If the file does not exist or cannot be read
     */
    public static SensitiveApiList load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new ConfigurationException("Sensitive API list not found: " + path);
        }
        try {
            return parse(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read sensitive API list: " + path, e);
        }
    }

    public boolean contains(String name) {
        return name != null && names.contains(name.strip());
    }

    public Set<String> names() {
        return names;
    }

    public int size() {
        return names.size();
    }
}
