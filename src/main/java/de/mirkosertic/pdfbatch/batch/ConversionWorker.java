package de.mirkosertic.pdfbatch.batch;

import de.mirkosertic.pdfbatch.engine.ConversionException;
import de.mirkosertic.pdfbatch.engine.FailureReason;
import de.mirkosertic.pdfbatch.naming.ResolvedName;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Pulls items from the batch queue and converts them with its own {@link ConversionSession}
 * until the queue is empty, a stop is requested or its engine cannot be started.
 */
public class ConversionWorker implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(ConversionWorker.class);

    public enum WorkerState {
        IDLE,
        CLAIMING,
        CONVERTING,
        REPORTING,
        EXITED
    }

    private final String name;
    private final BatchHandle batch;
    private final ConversionSession session;

    private volatile WorkerState state = WorkerState.IDLE;
    private int converted;

    public ConversionWorker(final String name, final BatchHandle batch, final ConversionSession session) {
        this.name = name;
        this.batch = batch;
        this.session = session;
    }

    @Override
    public void run() {
        logger.debug("{} started", name);
        WorkItem inHand = null;
        try {
            while (!Thread.currentThread().isInterrupted()) {
                state = WorkerState.CLAIMING;
                final WorkItem item = batch.claimNext();
                if (item == null) {
                    break;
                }
                inHand = item;

                state = WorkerState.CONVERTING;
                final ConversionOutcome outcome = process(item);
                if (outcome == null) {
                    // Engine unavailable, item went back to the queue
                    inHand = null;
                    break;
                }

                state = WorkerState.REPORTING;
                inHand = null;
                batch.report(outcome);
                converted++;
            }
        } catch (final RuntimeException e) {
            logger.error("{} terminated unexpectedly", name, e);
            if (inHand != null) {
                batch.report(ConversionOutcome.failed(inHand, null, FailureReason.ENGINE_ERROR,
                        "Unexpected error: " + e.getMessage(), name, 0));
            }
        } finally {
            try {
                session.close();
            } finally {
                state = WorkerState.EXITED;
                logger.debug("{} exiting after {} item(s)", name, converted);
                batch.workerExited(this);
            }
        }
    }

    /**
     * Convert one item.
     *
     * @return the outcome, or {@code null} if the engine could not be started and the item was
     * handed back to the queue
     */
    @Nullable ConversionOutcome process(final WorkItem item) {
        final long start = System.currentTimeMillis();
        final Path source = item.sourcePath();

        // Step 1: the source must still exist; checked before a name is claimed
        if (!Files.isRegularFile(source)) {
            return ConversionOutcome.failed(item, null, FailureReason.SOURCE_UNAVAILABLE,
                    "Source file does not exist: " + source, name, elapsedSince(start));
        }

        // Step 2: start the engine lazily; a worker without an engine gives its item back
        try {
            session.ensureStarted();
        } catch (final ConversionException e) {
            batch.requeue(item);
            batch.engineUnavailable(this);
            batch.log(LogLevel.ERROR, "{}: {} ({}), worker stops and leaves remaining files to other workers",
                    name, e.getReason().getLabel(), e.getMessage());
            return null;
        }

        // Step 3: claim a collision-free target name
        final ResolvedName resolved;
        try {
            resolved = batch.resolveName(item.desiredBaseName());
        } catch (final ConversionException e) {
            return ConversionOutcome.failed(item, null, e.getReason(), e.getMessage(), name, elapsedSince(start));
        }

        // Step 4: convert
        final String activeKey = source.toString();
        batch.statistics().registerActiveFile(activeKey, name);
        try {
            session.convert(source, resolved.targetPath());
            return ConversionOutcome.converted(item, resolved, name, elapsedSince(start));
        } catch (final ConversionException e) {
            logger.debug("{}: conversion of {} failed", name, source, e);
            return ConversionOutcome.failed(item, resolved, e.getReason(), e.getMessage(), name, elapsedSince(start));
        } finally {
            batch.statistics().unregisterActiveFile(activeKey);
        }
    }

    public String getName() {
        return name;
    }

    public WorkerState getState() {
        return state;
    }

    private static long elapsedSince(final long start) {
        return System.currentTimeMillis() - start;
    }
}
