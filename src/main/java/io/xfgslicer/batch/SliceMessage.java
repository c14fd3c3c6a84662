package io.xfgslicer.batch;

import java.nio.file.Path;

/**
 * Message from a worker to the output consumer. A message with {@code finished} set ends
 * the consumer loop.
 *
 * @param sourceFile File the message is about, null for the end marker
 * @param outcome    Processing result, null if the file failed
 * @param error      Failure cause, null on success
 * @param finished   End-of-stream marker
 */
record SliceMessage(Path sourceFile, FileOutcome outcome, Throwable error, boolean finished) {

    static SliceMessage of(Path sourceFile, FileOutcome outcome) {
        return new SliceMessage(sourceFile, outcome, null, false);
    }

    static SliceMessage failed(Path sourceFile, Throwable error) {
        return new SliceMessage(sourceFile, null, error, false);
    }

    static SliceMessage endOfStream() {
        return new SliceMessage(null, null, null, true);
    }
}
