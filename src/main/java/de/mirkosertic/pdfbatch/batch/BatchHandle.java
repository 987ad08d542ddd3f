package de.mirkosertic.pdfbatch.batch;

import de.mirkosertic.pdfbatch.engine.ConversionException;
import de.mirkosertic.pdfbatch.naming.FilenameResolver;
import de.mirkosertic.pdfbatch.naming.NamingRule;
import de.mirkosertic.pdfbatch.naming.ResolvedName;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.MessageFormatter;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * State of one running batch, shared by its workers.
 * <p>
 * Three pieces of state are touched by more than one worker, each behind its own lock:
 * the work queue together with the stop flag, the claimed-name registry (inside the
 * {@link FilenameResolver}) and the results list. Everything else belongs to a single worker.
 */
public class BatchHandle {

    private static final Logger logger = LoggerFactory.getLogger(BatchHandle.class);

    private final Path outputDirectory;
    private final NamingRule namingRule;
    private final int total;
    private final FilenameResolver resolver;
    private final BatchStatisticsTracker statistics;
    private final BatchListener listener;

    private final Object queueLock = new Object();
    private final Deque<WorkItem> queue;
    private boolean stopRequested;
    private boolean finished;

    private final Object resultsLock = new Object();
    private final List<ConversionOutcome> results = new ArrayList<>();

    private final AtomicInteger activeWorkerCount;
    private final AtomicInteger workersWithoutEngine = new AtomicInteger();
    private final CountDownLatch completion = new CountDownLatch(1);
    private volatile @Nullable BatchSummary summary;
    private volatile Runnable onTerminal = () -> { };

    BatchHandle(final List<WorkItem> items, final Path outputDirectory, final NamingRule namingRule,
                final int workerCount, final FilenameResolver resolver,
                final BatchStatisticsTracker statistics, final BatchListener listener) {
        this.queue = new ArrayDeque<>(items);
        this.total = items.size();
        this.outputDirectory = outputDirectory;
        this.namingRule = namingRule;
        this.resolver = resolver;
        this.statistics = statistics;
        this.listener = listener;
        this.activeWorkerCount = new AtomicInteger(workerCount);
    }

    /**
     * Ask the batch to stop: items already being converted finish, queued items are not started.
     *
     * @return {@code true} if this call changed the state, {@code false} if a stop was already
     * requested or the batch has completed
     */
    public boolean requestStop() {
        final int queued;
        synchronized (queueLock) {
            if (stopRequested || finished) {
                return false;
            }
            stopRequested = true;
            queued = queue.size();
        }
        log(LogLevel.WARNING, "Stop requested: waiting for {} file(s) in progress, {} queued file(s) will not be converted",
                activeWorkerCount.get() == 0 ? 0 : statistics.getProgress(queued).currentlyProcessing().size(), queued);
        return true;
    }

    public boolean isStopRequested() {
        synchronized (queueLock) {
            return stopRequested;
        }
    }

    public boolean isDone() {
        return completion.getCount() == 0;
    }

    /**
     * Block until every worker has exited.
     */
    public BatchSummary awaitCompletion() throws InterruptedException {
        completion.await();
        return summary;
    }

    public BatchSummary awaitCompletion(final Duration timeout) throws InterruptedException, TimeoutException {
        if (!completion.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            throw new TimeoutException("Batch did not complete within " + timeout.toMillis() + "ms");
        }
        return summary;
    }

    public Optional<BatchSummary> getSummary() {
        return Optional.ofNullable(summary);
    }

    public BatchProgress getProgress() {
        return statistics.getProgress(queueSize());
    }

    public int getTotal() {
        return total;
    }

    public int getActiveWorkerCount() {
        return activeWorkerCount.get();
    }

    public Path getOutputDirectory() {
        return outputDirectory;
    }

    public NamingRule getNamingRule() {
        return namingRule;
    }

    /**
     * Take the next item, or {@code null} if the queue is empty or a stop was requested.
     */
    @Nullable WorkItem claimNext() {
        synchronized (queueLock) {
            if (stopRequested) {
                return null;
            }
            return queue.pollFirst();
        }
    }

    /**
     * Put an item back at the head of the queue for another worker.
     */
    void requeue(final WorkItem item) {
        synchronized (queueLock) {
            queue.addFirst(item);
        }
    }

    /**
     * Record that a worker gave up because its engine could not be started.
     */
    void engineUnavailable(final ConversionWorker worker) {
        final int count = workersWithoutEngine.incrementAndGet();
        logger.debug("{} has no engine, {} worker(s) without engine so far", worker.getName(), count);
    }

    ResolvedName resolveName(final String desiredBaseName) throws ConversionException {
        return resolver.resolve(desiredBaseName);
    }

    BatchStatisticsTracker statistics() {
        return statistics;
    }

    void report(final ConversionOutcome outcome) {
        synchronized (resultsLock) {
            results.add(outcome);
        }
        statistics.record(outcome);

        // The outcome is recorded; nothing below may end the worker
        final WorkItem item = outcome.item();
        try {
            final String source = displayName(item.sourcePath());
            switch (outcome.status()) {
                case SUCCEEDED -> log(LogLevel.INFO, "[{}/{}] Converted: {} -> {}",
                        item.index(), total, source, displayName(outcome.targetPath()));
                case RENAMED -> log(LogLevel.INFO, "[{}/{}] Converted: {} -> {} (renamed, {} already exists)",
                        item.index(), total, source, displayName(outcome.targetPath()),
                        displayName(outcome.desiredPath()));
                default -> log(LogLevel.ERROR, "[{}/{}] Failed: {} ({}: {})",
                        item.index(), total, source,
                        outcome.failureReason() == null ? outcome.status() : outcome.failureReason().getLabel(),
                        outcome.message());
            }
        } catch (final RuntimeException e) {
            logger.error("Could not log the outcome of item {}", item.index(), e);
        }

        try {
            listener.onItemCompleted(outcome, statistics.getProgress(queueSize()));
        } catch (final RuntimeException e) {
            logger.error("Batch listener failed on item completion", e);
        }
    }

    static String displayName(final @Nullable Path path) {
        if (path == null) {
            return "-";
        }
        final Path fileName = path.getFileName();
        return fileName == null ? path.toString() : fileName.toString();
    }

    void workerExited(final ConversionWorker worker) {
        final int remaining = activeWorkerCount.decrementAndGet();
        logger.debug("{} exited, {} worker(s) still active", worker.getName(), remaining);
        if (remaining == 0) {
            complete();
        }
    }

    void onTerminal(final Runnable callback) {
        this.onTerminal = callback;
    }

    /**
     * Build the summary once the last worker is gone. Items still queued were never started.
     */
    void complete() {
        final List<WorkItem> notStarted;
        final boolean stopped;
        synchronized (queueLock) {
            notStarted = new ArrayList<>(queue);
            queue.clear();
            stopped = stopRequested;
            finished = true;
        }
        final boolean engineUnavailable = workersWithoutEngine.get() > 0;
        notStarted.sort(Comparator.comparingInt(WorkItem::index));

        final List<ConversionOutcome> outcomes;
        synchronized (resultsLock) {
            outcomes = List.copyOf(results);
        }

        statistics.stopPeriodicNotifications();
        final BatchSummary result = BatchSummary.of(outputDirectory, total, stopped,
                engineUnavailable, statistics.getStartTime(), outcomes, notStarted);
        summary = result;

        if (!notStarted.isEmpty() && !stopped) {
            if (engineUnavailable) {
                log(LogLevel.ERROR, "No conversion engine could be started, {} file(s) were not converted",
                        notStarted.size());
            } else {
                log(LogLevel.ERROR, "All workers ended unexpectedly, {} file(s) were not converted",
                        notStarted.size());
            }
        }
        log(LogLevel.INFO, "Batch complete in {}ms. Converted: {}, renamed: {}, failed: {}, not processed: {}, total: {}",
                result.elapsedTimeMs(), result.succeeded(), result.renamed(), result.failed(),
                result.notProcessed(), result.total());

        try {
            listener.onBatchCompleted(result);
        } catch (final RuntimeException e) {
            logger.error("Batch listener failed on batch completion", e);
        }
        try {
            onTerminal.run();
        } finally {
            completion.countDown();
        }
    }

    void log(final LogLevel level, final String pattern, final Object... args) {
        final String message = MessageFormatter.arrayFormat(pattern, args).getMessage();
        switch (level) {
            case INFO -> logger.info(message);
            case WARNING -> logger.warn(message);
            case ERROR -> logger.error(message);
        }
        try {
            listener.onLog(level, message);
        } catch (final RuntimeException e) {
            logger.error("Batch listener failed on log line", e);
        }
    }

    void startProgressReporting() {
        statistics.startPeriodicNotifications(message -> log(LogLevel.INFO, message), this::queueSize);
    }

    private int queueSize() {
        synchronized (queueLock) {
            return queue.size();
        }
    }
}
