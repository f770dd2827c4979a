package com.eainde.workout.thread;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs fire-and-forget side effects on a bounded pool with the caller's MDC, so a failure
 * in a background task is still logged against the run that submitted it.
 */
@Slf4j
public class MdcAwareExecutor implements Executor {

    private final ExecutorService delegate;

    public MdcAwareExecutor(ExecutorService delegate) {
        this.delegate = delegate;
    }

    /**
     * Fixed pool of {@code poolSize} threads with a queue of {@code queueCapacity}.
     * Submissions beyond that are rejected with {@link RejectedExecutionException}.
     */
    public static MdcAwareExecutor bounded(int poolSize, int queueCapacity) {
        AtomicInteger threadNumber = new AtomicInteger();
        ThreadPoolExecutor pool = new ThreadPoolExecutor(poolSize, poolSize, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                runnable -> {
                    Thread thread = new Thread(runnable, "workout-background-" + threadNumber.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                },
                new ThreadPoolExecutor.AbortPolicy());
        return new MdcAwareExecutor(pool);
    }

    @Override
    public void execute(Runnable command) {
        // Capture MDC context from the submitting thread
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();

        delegate.execute(() -> {
            if (parentMdc != null) {
                MDC.setContextMap(parentMdc);
            }
            try {
                command.run();
            } finally {
                MDC.clear();
            }
        });
    }

    /**
     * Submits {@code task} without waiting for it. Failures, including a full queue,
     * are logged and never reach the caller.
     */
    public void runDetached(String taskName, Runnable task) {
        try {
            execute(() -> {
                try {
                    task.run();
                    log.debug("Background task {} completed", taskName);
                } catch (RuntimeException e) {
                    log.warn("Background task {} failed: {}", taskName, e.getMessage(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Background task {} rejected: {}", taskName, e.getMessage());
        }
    }

    public void shutdown() {
        delegate.shutdown();
    }
}
