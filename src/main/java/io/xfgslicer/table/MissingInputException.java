package io.xfgslicer.table;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Thrown when a table file that was asked for does not exist.
 */
public class MissingInputException extends IOException {

    public MissingInputException(Path path) {
        super("No such table: " + path);
    }
}
