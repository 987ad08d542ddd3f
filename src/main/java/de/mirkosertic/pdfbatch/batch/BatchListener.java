package de.mirkosertic.pdfbatch.batch;

/**
 * Receives the log stream and results of a batch, typically a user interface.
 * <p>
 * Callbacks arrive on worker threads. Implementations must be thread-safe and should return
 * quickly; exceptions are logged and otherwise ignored.
 */
public interface BatchListener {

    BatchListener NONE = new BatchListener() {
    };

    default void onLog(final LogLevel level, final String message) {
    }

    default void onItemCompleted(final ConversionOutcome outcome, final BatchProgress progress) {
    }

    default void onBatchCompleted(final BatchSummary summary) {
    }
}
