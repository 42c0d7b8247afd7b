package org.neuralchilli.marshal.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded pool running step handlers. Timeouts and retry delays never block a
 * pool thread: the first is {@link CompletableFuture#orTimeout}, armed when a
 * task starts, the second a delayed executor in front of the pool.
 */
public class WorkerPool {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final String workerId;
    private final ExecutorService executorService;
    private volatile boolean running = true;

    public WorkerPool(String workerId, int workerThreads) {
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be >= 1, got: " + workerThreads);
        }
        this.workerId = workerId;
        this.executorService = Executors.newFixedThreadPool(workerThreads, new WorkerThreadFactory(workerId));
        log.info("Worker pool started: {} threads, worker ID: {}", workerThreads, workerId);
    }

    /**
     * Run {@code task} on the pool. Once the task starts, the returned future
     * fails with a {@link TimeoutException} if it has not finished within
     * {@code timeout}, and the task's thread is interrupted. Time spent queued
     * for a free thread does not count.
     */
    public <T> CompletableFuture<T> submit(Callable<T> task, Duration timeout) {
        CompletableFuture<T> result = new CompletableFuture<>();
        Future<?> handle = executorService.submit(() -> {
            if (result.isDone()) {
                return;
            }
            result.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
            try {
                result.complete(task.call());
            } catch (Exception e) {
                result.completeExceptionally(e);
            }
        });
        result.whenComplete((value, error) -> {
            if (error instanceof TimeoutException || error instanceof CancellationException) {
                handle.cancel(true);
            }
        });
        return result;
    }

    /**
     * Executor for continuation work (callbacks, scheduling decisions)
     */
    public Executor executor() {
        return executorService;
    }

    /**
     * Executor that starts its tasks on the pool after {@code delay}
     */
    public Executor delayed(Duration delay) {
        return CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS, executorService);
    }

    /**
     * Stop the pool gracefully, letting in-flight handlers finish.
     */
    public void shutdown() {
        if (!running) {
            return;
        }
        running = false;
        log.info("Stopping worker pool {}...", workerId);

        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(60, TimeUnit.SECONDS)) {
                log.warn("Worker pool did not terminate in 60 seconds, forcing shutdown");
                executorService.shutdownNow();
                if (!executorService.awaitTermination(10, TimeUnit.SECONDS)) {
                    log.error("Worker pool did not terminate after forced shutdown");
                }
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }

        log.info("Worker pool stopped");
    }

    /**
     * Thread factory for creating named worker threads.
     */
    private static class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(0);
        private final String workerId;

        WorkerThreadFactory(String workerId) {
            this.workerId = workerId;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r);
            t.setName(workerId + "-thread-" + counter.incrementAndGet());
            t.setDaemon(false);
            return t;
        }
    }
}
