package de.mirkosertic.pdfbatch.batch;

import de.mirkosertic.pdfbatch.engine.ConversionEngine;
import de.mirkosertic.pdfbatch.engine.ConversionException;
import de.mirkosertic.pdfbatch.engine.DocumentHandle;
import de.mirkosertic.pdfbatch.engine.EngineHandle;
import de.mirkosertic.pdfbatch.engine.FailureReason;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntPredicate;

/**
 * In-memory conversion engine for batch tests. Writes the target with {@code CREATE_NEW}, so
 * any attempt to write the same target twice surfaces as a failed item.
 */
class FakeConversionEngine implements ConversionEngine {

    private final AtomicInteger started = new AtomicInteger();
    private final AtomicInteger stopped = new AtomicInteger();
    private final AtomicInteger startAttempts = new AtomicInteger();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    private final Map<Integer, Set<String>> callingThreads = new ConcurrentHashMap<>();
    private final Map<String, FailureReason> failingSources = new ConcurrentHashMap<>();

    private volatile IntPredicate startFails = attempt -> false;
    private volatile CountDownLatch gate = new CountDownLatch(0);
    private volatile CountDownLatch entered = new CountDownLatch(0);
    private volatile long convertDelayMs;

    /** Start attempts for which the predicate (1-based attempt number) holds fail. */
    FakeConversionEngine failStartWhen(final IntPredicate predicate) {
        this.startFails = predicate;
        return this;
    }

    FakeConversionEngine failConversionOf(final String fileName, final FailureReason reason) {
        failingSources.put(fileName, reason);
        return this;
    }

    /**
     * Every conversion counts down {@code entered} and then blocks until {@code gate} opens.
     */
    FakeConversionEngine blockOn(final CountDownLatch gate, final CountDownLatch entered) {
        this.gate = gate;
        this.entered = entered;
        return this;
    }

    FakeConversionEngine withDelay(final long delayMs) {
        this.convertDelayMs = delayMs;
        return this;
    }

    @Override
    public String engineName() {
        return "Fake";
    }

    @Override
    public EngineHandle startEngine() throws ConversionException {
        final int attempt = startAttempts.incrementAndGet();
        if (startFails.test(attempt)) {
            throw new ConversionException(FailureReason.ENGINE_UNAVAILABLE, "Fake engine refused to start");
        }
        final int instance = started.incrementAndGet();
        final FakeHandle handle = new FakeHandle(instance);
        handle.recordThread();
        return handle;
    }

    int startedCount() {
        return started.get();
    }

    int stoppedCount() {
        return stopped.get();
    }

    int startAttempts() {
        return startAttempts.get();
    }

    int maxInFlight() {
        return maxInFlight.get();
    }

    Map<Integer, Set<String>> callingThreads() {
        return callingThreads;
    }

    private final class FakeHandle implements EngineHandle {

        private final int instance;

        private FakeHandle(final int instance) {
            this.instance = instance;
        }

        private void recordThread() {
            callingThreads.computeIfAbsent(instance, k -> ConcurrentHashMap.newKeySet())
                    .add(Thread.currentThread().getName());
        }

        @Override
        public DocumentHandle openDocument(final Path source) throws ConversionException {
            recordThread();
            if (!Files.isRegularFile(source)) {
                throw new ConversionException(FailureReason.SOURCE_UNAVAILABLE, "No such file: " + source);
            }
            final FailureReason failure = failingSources.get(source.getFileName().toString());
            if (failure == FailureReason.SOURCE_LOCKED) {
                throw new ConversionException(failure, "Locked: " + source);
            }
            return new FakeDocument(this, source);
        }

        @Override
        public void stopEngine() {
            recordThread();
            stopped.incrementAndGet();
        }
    }

    private final class FakeDocument implements DocumentHandle {

        private final FakeHandle handle;
        private final Path source;

        private FakeDocument(final FakeHandle handle, final Path source) {
            this.handle = handle;
            this.source = source;
        }

        @Override
        public void exportAs(final Path target) throws ConversionException {
            handle.recordThread();
            final int now = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(now, Math::max);
            try {
                entered.countDown();
                if (!gate.await(30, TimeUnit.SECONDS)) {
                    throw new ConversionException(FailureReason.ENGINE_ERROR, "Gate was never opened");
                }
                if (convertDelayMs > 0) {
                    Thread.sleep(convertDelayMs);
                }
                final FailureReason failure = failingSources.get(source.getFileName().toString());
                if (failure != null) {
                    throw new ConversionException(failure, "Configured failure for " + source.getFileName());
                }
                Files.writeString(target, "converted from " + source, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            } catch (final FileAlreadyExistsException e) {
                throw new ConversionException(FailureReason.ENGINE_ERROR, "Target written twice: " + target, e);
            } catch (final ConversionException e) {
                throw e;
            } catch (final IOException e) {
                throw new ConversionException(FailureReason.ENGINE_ERROR, e.getMessage(), e);
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ConversionException(FailureReason.ENGINE_ERROR, "Interrupted", e);
            } finally {
                inFlight.decrementAndGet();
            }
        }

        @Override
        public void close() {
            handle.recordThread();
        }
    }
}
