package de.mirkosertic.pdfbatch.batch;

import de.mirkosertic.pdfbatch.engine.ConversionEngine;
import de.mirkosertic.pdfbatch.engine.ConversionException;
import de.mirkosertic.pdfbatch.engine.DocumentHandle;
import de.mirkosertic.pdfbatch.engine.EngineHandle;
import de.mirkosertic.pdfbatch.engine.FailureReason;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Owns the conversion engine instance of one worker.
 * <p>
 * The engine is started on first use and reused for every following document. All calls into
 * one engine instance are made from a single dedicated thread, so engines with thread affinity
 * always see the same caller. Every call is bounded by the configured timeout; an engine that
 * times out is discarded and a fresh instance is started for the next document.
 * <p>
 * Not thread-safe: a session belongs to exactly one worker.
 */
public class ConversionSession implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ConversionSession.class);

    private final ConversionEngine engine;
    private final Duration timeout;
    private final String name;

    private @Nullable ExecutorService callThread;
    private @Nullable EngineHandle handle;
    private int enginesStarted;
    private boolean closed;

    public ConversionSession(final ConversionEngine engine, final Duration timeout, final String name) {
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("Engine timeout must be positive: " + timeout);
        }
        this.engine = engine;
        this.timeout = timeout;
        this.name = name;
    }

    /**
     * Start the engine unless it is already running.
     *
     * @throws ConversionException with {@link FailureReason#ENGINE_UNAVAILABLE}
     */
    public void ensureStarted() throws ConversionException {
        if (closed) {
            throw new IllegalStateException("Session " + name + " is closed");
        }
        if (handle != null) {
            return;
        }
        final ExecutorService executor = newCallThread();
        final PendingStart pending = new PendingStart();
        try {
            handle = call(executor, () -> {
                final EngineHandle started = engine.startEngine();
                if (!pending.deliver(started)) {
                    logger.warn("{}: {} engine started after the caller gave up, stopping it", name, engine.engineName());
                    stopQuietly(started);
                }
                return started;
            });
            callThread = executor;
            enginesStarted++;
            logger.info("{}: started {} engine instance #{}", name, engine.engineName(), enginesStarted);
        } catch (final ConversionException e) {
            executor.shutdownNow();
            final EngineHandle late = pending.abandon();
            if (late != null) {
                logger.warn("{}: stopping {} engine that started after the timeout", name, engine.engineName());
                stopQuietly(late);
            }
            if (e.getReason() == FailureReason.ENGINE_UNAVAILABLE) {
                throw e;
            }
            throw new ConversionException(FailureReason.ENGINE_UNAVAILABLE,
                    engine.engineName() + " could not be started: " + e.getMessage(), e);
        }
    }

    /**
     * Convert one document with this session's engine, starting it if necessary.
     */
    public void convert(final Path source, final Path target) throws ConversionException {
        ensureStarted();
        final EngineHandle current = handle;
        try {
            call(callThread, () -> {
                try (DocumentHandle document = current.openDocument(source)) {
                    document.exportAs(target);
                }
                return null;
            });
        } catch (final ConversionException e) {
            if (e.getReason() == FailureReason.ENGINE_TIMEOUT || e.getReason() == FailureReason.ENGINE_UNAVAILABLE) {
                discardEngine(e.getReason().getLabel());
            }
            throw new ConversionException(e.getReason(), e.getMessage(), source.toString(), e.getCause());
        }
    }

    public boolean isStarted() {
        return handle != null;
    }

    /**
     * @return number of engine instances this session has started so far
     */
    public int getEnginesStarted() {
        return enginesStarted;
    }

    public String getName() {
        return name;
    }

    /**
     * Stop the engine. Safe to call more than once; only the first call has an effect.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        final EngineHandle current = handle;
        final ExecutorService executor = callThread;
        handle = null;
        callThread = null;
        if (current == null || executor == null) {
            return;
        }
        try {
            call(executor, () -> {
                current.stopEngine();
                return null;
            });
            logger.info("{}: stopped {} engine", name, engine.engineName());
        } catch (final ConversionException e) {
            logger.warn("{}: engine did not stop cleanly: {}", name, e.getMessage());
        } finally {
            executor.shutdownNow();
        }
    }

    private void discardEngine(final String cause) {
        logger.warn("{}: discarding {} engine instance ({})", name, engine.engineName(), cause);
        final EngineHandle current = handle;
        final ExecutorService executor = callThread;
        handle = null;
        callThread = null;
        if (executor != null) {
            executor.shutdownNow();
        }
        if (current != null) {
            stopQuietly(current);
        }
    }

    private void stopQuietly(final EngineHandle current) {
        try {
            current.stopEngine();
        } catch (final RuntimeException e) {
            logger.warn("{}: error while stopping engine", name, e);
        }
    }

    private <T> T call(final ExecutorService executor, final Callable<T> task) throws ConversionException {
        final Future<T> future = executor.submit(task);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (final ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof ConversionException) {
                throw (ConversionException) cause;
            }
            throw new ConversionException(FailureReason.ENGINE_ERROR,
                    engine.engineName() + " failed: " + cause, cause);
        } catch (final TimeoutException e) {
            future.cancel(true);
            throw new ConversionException(FailureReason.ENGINE_TIMEOUT,
                    engine.engineName() + " did not respond within " + timeout.toMillis() + "ms", e);
        } catch (final InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ConversionException(FailureReason.ENGINE_ERROR, "Interrupted while waiting for "
                    + engine.engineName(), e);
        }
    }

    /**
     * Hands a started engine to the waiting caller, or back to the call thread once the caller gave up.
     */
    private static final class PendingStart {

        private @Nullable EngineHandle started;
        private boolean abandoned;

        synchronized boolean deliver(final EngineHandle handle) {
            if (abandoned) {
                return false;
            }
            started = handle;
            return true;
        }

        synchronized @Nullable EngineHandle abandon() {
            abandoned = true;
            return started;
        }
    }

    private ExecutorService newCallThread() {
        final int instance = enginesStarted + 1;
        return Executors.newSingleThreadExecutor(r -> {
            final Thread t = new Thread(r, name + "-engine-" + instance);
            t.setDaemon(true);
            return t;
        });
    }
}
