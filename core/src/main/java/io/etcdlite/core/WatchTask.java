// file: core/src/main/java/io/etcdlite/core/WatchTask.java
package io.etcdlite.core;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Cancellation handle for a watch.
 * <p>
 * Lifecycle:
 *  - The store attaches the subscription id and binds a hook with {@link #whenCancelled(Runnable)} at registration.
 *  - {@link #cancel()} runs the bound hooks exactly once, on the calling thread.
 *  - The store then resolves {@link #result()} with {@link Status#CANCELLED}.
 * Binding a hook after cancellation runs it immediately.
 */
public final class WatchTask {

    private final CompletableFuture<Status> result = new CompletableFuture<>();
    private final List<Runnable> hooks = new ArrayList<>();
    private boolean cancelled;
    private long subscriptionId = -1;

    /**
     * Attach this task to the watch subscription it controls. A task controls
     * at most one subscription, so attaching twice is a caller bug.
     */
    public synchronized void attach(long id) {
        if (subscriptionId != -1) {
            throw new IllegalStateException(
                    "task already controls subscription " + subscriptionId);
        }
        subscriptionId = id;
    }

    /** Id of the controlled subscription, or -1 if not attached yet. */
    public synchronized long subscriptionId() {
        return subscriptionId;
    }

    public void whenCancelled(Runnable hook) {
        boolean runNow;
        synchronized (this) {
            runNow = cancelled;
            if (!runNow) {
                hooks.add(hook);
            }
        }
        if (runNow) {
            hook.run();
        }
    }

    public void cancel() {
        List<Runnable> toRun;
        synchronized (this) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            toRun = List.copyOf(hooks);
            hooks.clear();
        }
        toRun.forEach(Runnable::run);
    }

    public synchronized boolean isCancelled() {
        return cancelled;
    }

    /** Resolve the task. Only the first call has any effect. */
    public boolean complete(Status status) {
        return result.complete(status);
    }

    /** Completes with the terminal status once the watch is torn down. */
    public CompletableFuture<Status> result() {
        return result;
    }
}
