// file: core/src/main/java/io/etcdlite/core/ManualScheduler.java
package io.etcdlite.core;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Deterministic scheduler: tasks queue up until {@link #runPending()} is called
 * on the driving thread.
 */
public final class ManualScheduler implements Scheduler {

    private final Deque<Runnable> queue = new ArrayDeque<>();

    @Override
    public synchronized void schedule(Runnable task) {
        queue.addLast(Objects.requireNonNull(task, "task"));
    }

    /**
     * Run queued tasks in FIFO order until the queue is empty, including tasks
     * that running tasks enqueue. Exceptions from a task propagate to the caller
     * and leave the remaining tasks queued.
     *
     * @return number of tasks that ran
     */
    public int runPending() {
        int ran = 0;
        Runnable next;
        while ((next = poll()) != null) {
            next.run();
            ran++;
        }
        return ran;
    }

    public synchronized int pending() {
        return queue.size();
    }

    private synchronized Runnable poll() {
        return queue.pollFirst();
    }
}
