package de.mirkosertic.pdfbatch.batch;

import java.util.List;

/**
 * Snapshot of a running batch.
 */
public record BatchProgress(
        int total,
        long succeeded,
        long renamed,
        long failed,
        int queued,
        long startTimeMs,
        long snapshotTimeMs,
        /** Files currently being converted. */
        List<ActiveFile> currentlyProcessing
) {

    public long completed() {
        return succeeded + renamed + failed;
    }

    public double filesPerSecond() {
        final long elapsedMs = snapshotTimeMs - startTimeMs;
        if (elapsedMs == 0) return 0;
        return (double) completed() / (elapsedMs / 1000.0);
    }

    public long elapsedTimeMs() {
        return snapshotTimeMs - startTimeMs;
    }

    /** A file a worker is converting right now. */
    public record ActiveFile(String filePath, String workerName, long processingDurationMs) {
    }
}
