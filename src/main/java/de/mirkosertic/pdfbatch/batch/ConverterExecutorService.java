package de.mirkosertic.pdfbatch.batch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed-size thread pool that runs the workers of one batch.
 */
public class ConverterExecutorService {

    private static final Logger logger = LoggerFactory.getLogger(ConverterExecutorService.class);

    private final ThreadPoolExecutor executor;

    public ConverterExecutorService(final int workerCount) {
        final AtomicInteger threadCounter = new AtomicInteger(0);
        final ThreadFactory threadFactory = r -> {
            final Thread thread = new Thread(r, "converter-" + threadCounter.getAndIncrement());
            thread.setDaemon(false);
            return thread;
        };

        this.executor = new ThreadPoolExecutor(
                workerCount,
                workerCount,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                threadFactory
        );

        logger.debug("ConverterExecutorService initialized with {} threads", workerCount);
    }

    public void execute(final Runnable task) {
        executor.execute(task);
    }

    /**
     * Stop accepting tasks. Running workers are not interrupted.
     */
    public void shutdown() {
        executor.shutdown();
    }

    /**
     * Wait for all workers to finish after {@link #shutdown()}.
     *
     * @return {@code true} if the pool terminated in time
     */
    public boolean awaitTermination(final Duration timeout) {
        try {
            return executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (final InterruptedException e) {
            logger.warn("Interrupted while waiting for converter threads to terminate");
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public boolean isTerminated() {
        return executor.isTerminated();
    }
}
