package de.mirkosertic.kbindexer.indexing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pool that parses the document trees of one indexing run.
 *
 * <p>Lives exactly as long as the preload: open it, submit one parse task per file, await the
 * futures, close it. Workers are daemon threads, so a run that fails half way never keeps the JVM
 * alive. {@link #close()} gives queued parse tasks a grace period, then cancels what has not
 * started and interrupts what is still running.</p>
 */
public class IndexingExecutorService implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(IndexingExecutorService.class);

    static final Duration DEFAULT_GRACE_PERIOD = Duration.ofSeconds(10);

    private final ThreadPoolExecutor executor;
    private final Duration gracePeriod;

    public IndexingExecutorService(final int threadPoolSize) {
        this(threadPoolSize, DEFAULT_GRACE_PERIOD);
    }

    IndexingExecutorService(final int threadPoolSize, final Duration gracePeriod) {
        if (threadPoolSize < 1) {
            throw new IllegalArgumentException("Thread pool size must be positive, was " + threadPoolSize);
        }
        this.gracePeriod = gracePeriod;

        final AtomicInteger threadCounter = new AtomicInteger(0);
        final ThreadFactory threadFactory = r -> {
            final Thread thread = new Thread(r, "tree-loader-" + threadCounter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
        // one task per discovered file, so the queue never needs to push back
        this.executor = new ThreadPoolExecutor(
                threadPoolSize,
                threadPoolSize,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                threadFactory);

        logger.debug("Tree loader pool started with {} threads", threadPoolSize);
    }

    public <T> Future<T> submit(final Callable<T> task) {
        return executor.submit(task);
    }

    public int getThreadPoolSize() {
        return executor.getCorePoolSize();
    }

    /**
     * Stops accepting tasks and waits up to the grace period. Tasks still queued after that are
     * cancelled, running ones are interrupted.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(gracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
                final List<Runnable> abandoned = executor.shutdownNow();
                for (final Runnable task : abandoned) {
                    if (task instanceof Future<?> future) {
                        future.cancel(false);
                    }
                }
                logger.warn("Tree loading still busy after {} ms, cancelled {} queued files",
                        gracePeriod.toMillis(), abandoned.size());
            }
        } catch (final InterruptedException e) {
            logger.error("Interrupted while waiting for the tree loader pool to finish", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.debug("Tree loader pool closed after {} parse tasks", executor.getCompletedTaskCount());
    }
}
