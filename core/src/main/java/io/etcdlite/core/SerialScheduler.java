// file: core/src/main/java/io/etcdlite/core/SerialScheduler.java
package io.etcdlite.core;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduler backed by a single worker thread.
 * <p>
 * The executor's queue is FIFO and it has exactly one thread, which gives the
 * ordering and non-overlap the {@link Scheduler} contract asks for. A task that
 * throws is logged and the worker moves on to the next one.
 */
public final class SerialScheduler implements Scheduler, AutoCloseable {
    private static final Logger log = Logger.getLogger(SerialScheduler.class.getName());

    private final ExecutorService exec;

    public SerialScheduler() {
        this("etcdlite-callbacks");
    }

    public SerialScheduler(String threadName) {
        Objects.requireNonNull(threadName, "threadName");
        this.exec = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void schedule(Runnable task) {
        Objects.requireNonNull(task, "task");
        exec.execute(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "scheduled callback failed", e);
            }
        });
    }

    /**
     * Block until every task scheduled before this call has run.
     *
     * @return false if the timeout elapsed first
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        CountDownLatch marker = new CountDownLatch(1);
        exec.execute(marker::countDown);
        return marker.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        exec.shutdown();
        try {
            if (!exec.awaitTermination(5, TimeUnit.SECONDS)) {
                exec.shutdownNow();
            }
        } catch (InterruptedException e) {
            exec.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
