package io.xfgslicer.table;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the tab-separated node and edge tables written by the code property graph extractor.
 * <p>
 * The first line is the header. Every following non-blank line becomes one row, keyed by
 * header name in header order. Short rows are padded with empty strings and surplus fields
 * are ignored. Values are trimmed but otherwise left as raw text.
 */
public final class TableLoader {

    private static final char DELIMITER = '\t';

    private TableLoader() {
    }

    /**
     * Loads all rows of a table, preserving row order.
     *
     * @param path The table file
     * @return Rows in file order (empty if the file has no data rows)
     * @throws MissingInputException If the file does not exist
     * @throws IOException           If the file cannot be read
     */
    public static List<Map<String, String>> load(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new MissingInputException(path);
        }

        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String headerLine = reader.readLine();
            if (headerLine == null) {
                return List.of();
            }
            // Header and rows are split the same way so leading empty columns stay aligned
            List<String> header = split(stripLineEnd(headerLine));

            List<Map<String, String>> rows = new ArrayList<>();
            String line;
            while ((line = reader.readLine()) != null) {
                String content = stripLineEnd(line);
                if (content.isBlank()) {
                    continue;
                }
                rows.add(toRow(header, split(content)));
            }
            return Collections.unmodifiableList(rows);
        }
    }

    private static Map<String, String> toRow(List<String> header, List<String> fields) {
        Map<String, String> row = new LinkedHashMap<>();
        for (int i = 0; i < header.size(); i++) {
            row.put(header.get(i), i < fields.size() ? fields.get(i) : "");
        }
        return Collections.unmodifiableMap(row);
    }

    /**
     * Splits on every tab, keeping empty fields, and trims each field.
     */
    static List<String> split(String line) {
        List<String> fields = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < line.length(); i++) {
            if (line.charAt(i) == DELIMITER) {
                fields.add(line.substring(start, i).strip());
                start = i + 1;
            }
        }
        fields.add(line.substring(start).strip());
        return fields;
    }

    private static String stripLineEnd(String line) {
        int end = line.length();
        while (end > 0 && (line.charAt(end - 1) == '\r' || line.charAt(end - 1) == '\n')) {
            end--;
        }
        return line.substring(0, end);
    }
}
