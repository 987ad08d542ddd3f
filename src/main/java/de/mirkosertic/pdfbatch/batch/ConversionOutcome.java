package de.mirkosertic.pdfbatch.batch;

import de.mirkosertic.pdfbatch.engine.FailureReason;
import de.mirkosertic.pdfbatch.naming.ResolvedName;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;

/**
 * The result of converting one dequeued {@link WorkItem}.
 */
public record ConversionOutcome(
        WorkItem item,
        OutcomeStatus status,
        /** Claimed target, {@code null} if the item failed before a name was claimed. */
        @Nullable Path targetPath,
        /** Target that was asked for; differs from {@code targetPath} only for renamed items. */
        @Nullable Path desiredPath,
        @Nullable FailureReason failureReason,
        String message,
        String workerName,
        long durationMs
) {

    public static ConversionOutcome converted(final WorkItem item, final ResolvedName name,
                                              final String workerName, final long durationMs) {
        if (name.renamed()) {
            return new ConversionOutcome(item, OutcomeStatus.RENAMED, name.targetPath(), name.desiredPath(), null,
                    "Renamed to avoid overwriting " + name.desiredPath().getFileName(), workerName, durationMs);
        }
        return new ConversionOutcome(item, OutcomeStatus.SUCCEEDED, name.targetPath(), name.desiredPath(), null,
                "", workerName, durationMs);
    }

    public static ConversionOutcome failed(final WorkItem item, final @Nullable ResolvedName name,
                                           final FailureReason reason, final String message,
                                           final String workerName, final long durationMs) {
        return new ConversionOutcome(item, OutcomeStatus.FAILED,
                name == null ? null : name.targetPath(),
                name == null ? null : name.desiredPath(),
                reason, message, workerName, durationMs);
    }

    public Path sourcePath() {
        return item.sourcePath();
    }
}
