package io.xfgslicer.batch;

import io.xfgslicer.model.FileSlices;
import io.xfgslicer.model.KeyLineCategory;
import io.xfgslicer.output.SliceWriter;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Slices many files in parallel.
 * <p>
 * Each file is one task on a fixed-size worker pool. Workers share no state; they put their
 * result on a bounded queue that a single consumer drains, so all output is written from one
 * thread. A file that fails, even with an {@link Error}, is counted and reported without
 * stopping the others. If the consumer itself dies the run fails instead of blocking on the
 * full queue.
 */
public class BatchSlicer {

    private static final long POLL_MILLIS = 100;

    private final FileSlicer fileSlicer;
    private final SliceWriter writer;
    private final int workers;
    private final int queueCapacity;
    private final Consumer<String> log;

    public BatchSlicer(FileSlicer fileSlicer, SliceWriter writer, int workers, int queueCapacity,
                       Consumer<String> log) {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be at least 1");
        }
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be at least 1");
        }
        this.fileSlicer = fileSlicer;
        this.writer = writer;
        this.workers = workers;
        this.queueCapacity = queueCapacity;
        this.log = log != null ? log : message -> { };
    }

    /**
     * Processes all files and waits for their output to be written.
     *
     * @throws InterruptedException  If the calling thread is interrupted while waiting
     * @throws IllegalStateException If the output consumer stopped before all files were written
     */
    public BatchSummary run(List<Path> sourceFiles) throws InterruptedException {
        Instant startTime = Instant.now();
        BlockingQueue<SliceMessage> queue = new ArrayBlockingQueue<>(queueCapacity);

        ExecutorService consumerExecutor = Executors.newSingleThreadExecutor(named("xfg-writer"));
        ExecutorService workerPool = Executors.newFixedThreadPool(workers, named("xfg-worker"));
        try {
            Future<OutputTally> consumer = consumerExecutor.submit(() -> drain(queue));

            for (Path sourceFile : sourceFiles) {
                workerPool.submit(() -> {
                    deliver(queue, processQuietly(sourceFile), consumer);
                    return null;
                });
            }

            workerPool.shutdown();
            while (!workerPool.awaitTermination(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                if (consumer.isDone()) {
                    workerPool.shutdownNow();
                    throw consumerStopped(consumer);
                }
            }
            deliver(queue, SliceMessage.endOfStream(), consumer);

            OutputTally tally = awaitConsumer(consumer);
            return new BatchSummary(
                    startTime,
                    Duration.between(startTime, Instant.now()),
                    sourceFiles.size(),
                    tally.sliced,
                    tally.skipped,
                    tally.failures.size(),
                    tally.slicesByCategory,
                    tally.failures
            );
        } finally {
            workerPool.shutdownNow();
            consumerExecutor.shutdownNow();
        }
    }

    private SliceMessage processQuietly(Path sourceFile) {
        try {
            return SliceMessage.of(sourceFile, fileSlicer.process(sourceFile));
        } catch (IOException | RuntimeException | Error e) {
            return SliceMessage.failed(sourceFile, e);
        }
    }

    /**
     * Puts a message on the queue, giving up once the consumer is no longer draining it.
     */
    private static void deliver(BlockingQueue<SliceMessage> queue, SliceMessage message,
                                Future<OutputTally> consumer) throws InterruptedException {
        while (!queue.offer(message, POLL_MILLIS, TimeUnit.MILLISECONDS)) {
            if (consumer.isDone()) {
                throw new IllegalStateException("Slice writer stopped before all results were delivered");
            }
        }
    }

    private OutputTally drain(BlockingQueue<SliceMessage> queue) throws InterruptedException {
        OutputTally tally = new OutputTally();
        while (true) {
            SliceMessage message = queue.take();
            if (message.finished()) {
                return tally;
            }
            if (message.error() != null) {
                tally.fail(message.sourceFile(), message.error());
                continue;
            }

            FileOutcome outcome = message.outcome();
            if (outcome.isSkipped()) {
                tally.skipped++;
                log.accept("  Skipped " + outcome.relativePath() + " (" + outcome.noGraphReason() + ")");
                continue;
            }

            try {
                FileSlices slices = outcome.slices();
                writer.write(slices, outcome.relativePath());
                tally.sliced++;
                slices.byCategory().forEach((category, list) ->
                        tally.slicesByCategory.merge(category, list.size(), Integer::sum));
                log.accept("  Sliced " + outcome.relativePath() + ": " + slices.totalSlices() + " slices");
            } catch (IOException | RuntimeException | Error e) {
                tally.fail(message.sourceFile(), e);
            }
        }
    }

    private OutputTally awaitConsumer(Future<OutputTally> consumer) throws InterruptedException {
        try {
            return consumer.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Slice writer stopped unexpectedly", e.getCause());
        }
    }

    /**
     * Builds the failure for a consumer that finished while workers were still running.
     */
    private IllegalStateException consumerStopped(Future<OutputTally> consumer) throws InterruptedException {
        try {
            consumer.get();
            return new IllegalStateException("Slice writer stopped before all files were written");
        } catch (ExecutionException e) {
            return new IllegalStateException("Slice writer stopped unexpectedly", e.getCause());
        }
    }

    private static ThreadFactory named(String prefix) {
        return new ThreadFactory() {
            private int count = 0;

            @Override
            public synchronized Thread newThread(Runnable r) {
                Thread thread = new Thread(r, prefix + "-" + (++count));
                thread.setDaemon(true);
                return thread;
            }
        };
    }

    /**
     * Counters owned by the consumer thread.
     */
    private final class OutputTally {
        private int sliced;
        private int skipped;
        private final Map<KeyLineCategory, Integer> slicesByCategory = new EnumMap<>(KeyLineCategory.class);
        private final List<BatchSummary.FileFailure> failures = new ArrayList<>();

        private void fail(Path sourceFile, Throwable error) {
            String message = error.getMessage() != null ? error.getMessage() : error.toString();
            failures.add(new BatchSummary.FileFailure(sourceFile, message));
            log.accept("  Failed " + sourceFile + ": " + message);
        }
    }
}
