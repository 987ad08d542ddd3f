package de.mirkosertic.pdfbatch.batch;

import de.mirkosertic.pdfbatch.engine.FailureReason;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.List;

/**
 * Final account of a batch. Every submitted item appears exactly once in {@link #perItem()}:
 * first the converted or failed items in completion order, then the items that were never
 * started in submission order.
 */
public record BatchSummary(
        int total,
        int succeeded,
        int renamed,
        int failed,
        int notProcessed,
        boolean stopRequested,
        Path outputDirectory,
        long startTimeMs,
        long endTimeMs,
        List<ItemSummary> perItem
) {

    public BatchSummary {
        perItem = List.copyOf(perItem);
    }

    static BatchSummary of(final Path outputDirectory, final int total, final boolean stopRequested,
                           final boolean engineUnavailable, final long startTimeMs,
                           final List<ConversionOutcome> outcomes, final List<WorkItem> notStarted) {
        int succeeded = 0;
        int renamed = 0;
        int failed = 0;
        final ItemSummary[] rows = new ItemSummary[outcomes.size() + notStarted.size()];
        int row = 0;
        for (final ConversionOutcome outcome : outcomes) {
            switch (outcome.status()) {
                case SUCCEEDED -> succeeded++;
                case RENAMED -> renamed++;
                case FAILED -> failed++;
                default -> throw new IllegalStateException("Unexpected outcome status " + outcome.status());
            }
            rows[row++] = new ItemSummary(outcome.sourcePath(), outcome.targetPath(), outcome.status(),
                    outcome.failureReason(), outcome.message());
        }
        final String notStartedMessage = notStartedMessage(stopRequested, engineUnavailable);
        for (final WorkItem item : notStarted) {
            rows[row++] = new ItemSummary(item.sourcePath(), null, OutcomeStatus.NOT_PROCESSED, null,
                    notStartedMessage);
        }
        return new BatchSummary(total, succeeded, renamed, failed, notStarted.size(), stopRequested,
                outputDirectory, startTimeMs, System.currentTimeMillis(), List.of(rows));
    }

    private static String notStartedMessage(final boolean stopRequested, final boolean engineUnavailable) {
        if (stopRequested) {
            return "Not processed, batch was stopped";
        }
        if (engineUnavailable) {
            return "Not processed, no conversion engine available";
        }
        return "Not processed, worker ended unexpectedly";
    }

    public long elapsedTimeMs() {
        return endTimeMs - startTimeMs;
    }

    /**
     * @return {@code true} if every item was converted, possibly under a new name
     */
    public boolean allConverted() {
        return succeeded + renamed == total;
    }

    /**
     * One row of the summary.
     */
    public record ItemSummary(
            Path source,
            @Nullable Path target,
            OutcomeStatus status,
            @Nullable FailureReason failureReason,
            String message
    ) {
    }
}
