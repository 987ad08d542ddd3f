package de.mirkosertic.pdfbatch.batch;

import de.mirkosertic.pdfbatch.config.ApplicationConfig;
import de.mirkosertic.pdfbatch.engine.ConversionEngine;
import de.mirkosertic.pdfbatch.engine.ConversionException;
import de.mirkosertic.pdfbatch.engine.FailureReason;
import de.mirkosertic.pdfbatch.naming.FilenameResolver;
import de.mirkosertic.pdfbatch.naming.NamingRule;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Starts batches: builds the work queue, prepares the output directory and launches one
 * {@link ConversionWorker} with its own {@link ConversionSession} per worker slot.
 * <p>
 * One batch runs at a time. {@link #start} returns immediately; progress and results are
 * delivered through the {@link BatchListener} and the returned {@link BatchHandle}.
 */
public class BatchCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(BatchCoordinator.class);

    public static final int DEFAULT_WORKER_COUNT = 4;

    private static final Duration SHUTDOWN_GRACE_PERIOD = Duration.ofSeconds(30);

    private final ApplicationConfig config;
    private final ConversionEngine engine;
    private final BatchListener listener;

    private @Nullable BatchHandle activeBatch;
    private @Nullable ConverterExecutorService activeExecutor;

    public BatchCoordinator(final ApplicationConfig config, final ConversionEngine engine) {
        this(config, engine, BatchListener.NONE);
    }

    public BatchCoordinator(final ApplicationConfig config, final ConversionEngine engine,
                            final BatchListener listener) {
        this.config = config;
        this.engine = engine;
        this.listener = listener;
    }

    /**
     * Start a batch with the configured naming rule and worker count.
     */
    public BatchHandle start(final List<Path> sources, final Path outputDirectory) throws ConversionException {
        return start(sources, outputDirectory, config.getNamingRule(), config.getWorkerCount());
    }

    /**
     * Start converting {@code sources} into {@code outputDirectory}.
     *
     * @throws ConversionException      with {@link FailureReason#OUTPUT_DIRECTORY_UNAVAILABLE} if the
     *                                  output directory cannot be created or written; no item is
     *                                  started in that case
     * @throws IllegalArgumentException if {@code workerCount} is less than one
     * @throws IllegalStateException    if another batch of this coordinator is still running
     */
    public synchronized BatchHandle start(final List<Path> sources, final Path outputDirectory,
                                          final NamingRule namingRule, final int workerCount)
            throws ConversionException {
        if (workerCount < 1) {
            throw new IllegalArgumentException("Worker count must be at least 1: " + workerCount);
        }
        if (activeBatch != null && !activeBatch.isDone()) {
            throw new IllegalStateException("A batch is already running");
        }

        // Step 1: the output directory must exist and be writable before any item starts
        final Path outDir = prepareOutputDirectory(outputDirectory);

        // Step 2: names already present in the output directory are taken
        final FilenameResolver resolver = new FilenameResolver(outDir, "." + config.getTargetFormat(),
                config.getMaxPathLength());
        try {
            resolver.seedFromDirectory();
        } catch (final IOException e) {
            throw new ConversionException(FailureReason.OUTPUT_DIRECTORY_UNAVAILABLE,
                    "Output directory cannot be listed: " + outDir + " (" + e.getMessage() + ")", e);
        }

        // Step 3: build the queue in submission order
        final List<WorkItem> items = new ArrayList<>(sources.size());
        for (int i = 0; i < sources.size(); i++) {
            final Path source = sources.get(i);
            final Path fileName = source.getFileName();
            final String baseName = NamingRule.baseNameOf(fileName == null ? source.toString() : fileName.toString());
            items.add(new WorkItem(source, namingRule.apply(baseName), i + 1));
        }

        final int workers = Math.min(workerCount, Math.max(items.size(), 1));
        final BatchStatisticsTracker statistics = new BatchStatisticsTracker(items.size(),
                config.getProgressIntervalMs());
        final BatchHandle batch = new BatchHandle(items, outDir, namingRule, workers, resolver, statistics, listener);
        activeBatch = batch;

        batch.log(LogLevel.INFO, "Converting {} file(s) to {} with {} worker(s), naming rule '{}'",
                items.size(), outDir, workers, namingRule.getLabel());

        if (items.isEmpty()) {
            batch.complete();
            return batch;
        }

        // Step 4: launch the workers
        final ConverterExecutorService executor = new ConverterExecutorService(workers);
        activeExecutor = executor;
        batch.onTerminal(() -> {
            executor.shutdown();
            batchFinished(batch);
        });
        batch.startProgressReporting();

        final Duration timeout = Duration.ofMillis(config.getEngineTimeoutMs());
        for (int i = 1; i <= workers; i++) {
            final String workerName = "worker-" + i;
            final ConversionSession session = new ConversionSession(engine, timeout, workerName);
            executor.execute(new ConversionWorker(workerName, batch, session));
        }
        return batch;
    }

    /**
     * Request a cooperative stop of the given batch. Idempotent.
     *
     * @return {@code true} if this call requested the stop
     */
    public boolean requestStop(final BatchHandle batch) {
        return batch.requestStop();
    }

    public BatchSummary awaitCompletion(final BatchHandle batch) throws InterruptedException {
        return batch.awaitCompletion();
    }

    /**
     * The output file name a source would get under the given rule, before uniqueness is
     * resolved against other items and existing files.
     */
    public String previewTargetName(final Path source, final NamingRule namingRule) {
        final Path fileName = source.getFileName();
        final String baseName = NamingRule.baseNameOf(fileName == null ? source.toString() : fileName.toString());
        return namingRule.apply(baseName) + "." + config.getTargetFormat();
    }

    public synchronized @Nullable BatchHandle getActiveBatch() {
        return activeBatch != null && !activeBatch.isDone() ? activeBatch : null;
    }

    /**
     * Stop the running batch, if any, and wait for its in-flight items.
     */
    public void shutdown() {
        final BatchHandle batch;
        final ConverterExecutorService executor;
        synchronized (this) {
            batch = activeBatch;
            executor = activeExecutor;
        }
        if (batch == null || batch.isDone()) {
            return;
        }
        logger.info("Shutting down, stopping running batch...");
        batch.requestStop();
        if (executor != null && !executor.awaitTermination(SHUTDOWN_GRACE_PERIOD)) {
            logger.warn("Workers did not finish within {}s", SHUTDOWN_GRACE_PERIOD.toSeconds());
        }
    }

    private synchronized void batchFinished(final BatchHandle batch) {
        if (activeBatch == batch) {
            activeExecutor = null;
        }
    }

    private Path prepareOutputDirectory(final Path outputDirectory) throws ConversionException {
        final Path outDir = outputDirectory.toAbsolutePath().normalize();
        try {
            Files.createDirectories(outDir);
        } catch (final IOException e) {
            throw new ConversionException(FailureReason.OUTPUT_DIRECTORY_UNAVAILABLE,
                    "Output directory cannot be created: " + outDir + " (" + e.getMessage() + ")", e);
        }
        if (!Files.isDirectory(outDir) || !Files.isWritable(outDir)) {
            throw new ConversionException(FailureReason.OUTPUT_DIRECTORY_UNAVAILABLE,
                    "Output directory is not writable: " + outDir);
        }
        return outDir;
    }
}
