package de.mirkosertic.pdfbatch.batch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.IntSupplier;
import java.util.stream.Collectors;

/**
 * Tracks the progress of one batch and periodically reports it.
 * Thread-safe for use from multiple worker threads.
 */
public class BatchStatisticsTracker {

    private static final Logger logger = LoggerFactory.getLogger(BatchStatisticsTracker.class);

    private final int total;
    private final long progressIntervalMs;

    private final AtomicLong succeeded = new AtomicLong(0);
    private final AtomicLong renamed = new AtomicLong(0);
    private final AtomicLong failed = new AtomicLong(0);

    // In-flight tracking (file path -> worker and start timestamp in millis)
    private final ConcurrentHashMap<String, ActiveEntry> activeFiles = new ConcurrentHashMap<>();

    private volatile ScheduledExecutorService progressTimerExecutor;
    private volatile ScheduledFuture<?> progressTimerFuture;

    private final long startTime;

    public BatchStatisticsTracker(final int total, final long progressIntervalMs) {
        this.total = total;
        this.progressIntervalMs = progressIntervalMs;
        this.startTime = System.currentTimeMillis();
    }

    public void record(final ConversionOutcome outcome) {
        switch (outcome.status()) {
            case SUCCEEDED -> succeeded.incrementAndGet();
            case RENAMED -> renamed.incrementAndGet();
            case FAILED -> failed.incrementAndGet();
            default -> logger.warn("Ignoring outcome with status {}", outcome.status());
        }
    }

    /** Register a file as currently being converted. */
    public void registerActiveFile(final String path, final String workerName) {
        activeFiles.put(path, new ActiveEntry(workerName, System.currentTimeMillis()));
    }

    /** Unregister a file after its conversion completed (success or failure). */
    public void unregisterActiveFile(final String path) {
        activeFiles.remove(path);
    }

    /**
     * Start reporting progress every {@code progressIntervalMs} to the given sink. Does nothing
     * if the interval is not positive.
     *
     * @param sink          receives the progress message
     * @param queueSizeView current number of queued items
     */
    public synchronized void startPeriodicNotifications(final Consumer<String> sink, final IntSupplier queueSizeView) {
        if (progressIntervalMs <= 0 || progressTimerFuture != null) {
            return;
        }
        progressTimerExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            final Thread t = new Thread(r, "progress-timer");
            t.setDaemon(true);
            return t;
        });
        progressTimerFuture = progressTimerExecutor.scheduleAtFixedRate(
                () -> sendProgressNotification(sink, queueSizeView),
                progressIntervalMs,
                progressIntervalMs,
                TimeUnit.MILLISECONDS
        );
        logger.debug("Started periodic progress notifications every {}ms", progressIntervalMs);
    }

    /**
     * Stop periodic progress notifications and release the timer thread.
     */
    public synchronized void stopPeriodicNotifications() {
        final ScheduledFuture<?> future = progressTimerFuture;
        if (future != null) {
            future.cancel(false);
            progressTimerFuture = null;
            logger.debug("Stopped periodic progress notifications");
        }
        final ScheduledExecutorService executor = progressTimerExecutor;
        if (executor != null) {
            executor.shutdown();
            progressTimerExecutor = null;
        }
    }

    String formatProgress(final BatchProgress progress) {
        final StringBuilder message = new StringBuilder();
        message.append(String.format(
                "Converted %d/%d files (%.2f files/sec, %d failed, %d queued)",
                progress.completed(),
                progress.total(),
                progress.filesPerSecond(),
                progress.failed(),
                progress.queued()
        ));
        final List<BatchProgress.ActiveFile> processing = progress.currentlyProcessing();
        if (!processing.isEmpty()) {
            final String fileNames = processing.stream()
                    .map(af -> BatchHandle.displayName(Paths.get(af.filePath())))
                    .collect(Collectors.joining(", "));
            message.append(" - processing: ").append(fileNames);
        }
        return message.toString();
    }

    private void sendProgressNotification(final Consumer<String> sink, final IntSupplier queueSizeView) {
        try {
            sink.accept(formatProgress(getProgress(queueSizeView.getAsInt())));
        } catch (final Exception e) {
            // ScheduledExecutorService silently cancels the task if it throws
            logger.error("Failed to send progress notification", e);
        }
    }

    public BatchProgress getProgress(final int queued) {
        final long now = System.currentTimeMillis();
        final List<BatchProgress.ActiveFile> currentlyProcessing = new ArrayList<>();
        for (final Map.Entry<String, ActiveEntry> entry : activeFiles.entrySet()) {
            currentlyProcessing.add(new BatchProgress.ActiveFile(entry.getKey(), entry.getValue().workerName(),
                    now - entry.getValue().startTimeMs()));
        }
        return new BatchProgress(
                total,
                succeeded.get(),
                renamed.get(),
                failed.get(),
                queued,
                startTime,
                now,
                List.copyOf(currentlyProcessing)
        );
    }

    public long getStartTime() {
        return startTime;
    }

    private record ActiveEntry(String workerName, long startTimeMs) {
    }
}
