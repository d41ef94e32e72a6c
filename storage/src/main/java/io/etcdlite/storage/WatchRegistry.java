// file: storage/src/main/java/io/etcdlite/storage/WatchRegistry.java
package io.etcdlite.storage;

import io.etcdlite.core.Node;
import io.etcdlite.core.Scheduler;
import io.etcdlite.core.WatchUpdate;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Consumer;

/**
 * Prefix -> subscribers, with notification fan-out through the scheduler.
 * <p>
 * Matching is plain string prefix: a watch on "/ab" sees "/abc" as well as
 * "/ab/c". Subscriptions are identified by an id handed out at registration.
 * <p>
 * Not thread safe: every call happens under the owning store's lock.
 * Notifications are only enqueued here, never run.
 */
public final class WatchRegistry {

    private final Scheduler scheduler;
    private final Map<String, List<Subscription>> byPrefix = new TreeMap<>();
    private long nextId = 1;

    public WatchRegistry(Scheduler scheduler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    /** @return the new subscription's id */
    public long register(String prefix, Consumer<List<WatchUpdate>> callback) {
        long id = allocateId();
        register(id, prefix, callback);
        return id;
    }

    /** Hand out an id ahead of {@link #register(long, String, Consumer)}. */
    public long allocateId() {
        return nextId++;
    }

    /** Register under an id obtained from {@link #allocateId()}. */
    public void register(long id, String prefix, Consumer<List<WatchUpdate>> callback) {
        Objects.requireNonNull(prefix, "prefix");
        Objects.requireNonNull(callback, "callback");
        byPrefix.computeIfAbsent(prefix, p -> new ArrayList<>()).add(new Subscription(id, callback));
    }

    /**
     * Schedule a single-element notification for {@code node} to every
     * subscription whose prefix matches its key.
     *
     * @return number of notifications scheduled
     */
    public int notifyFor(Node node) {
        List<WatchUpdate> update = List.of(new WatchUpdate(node, !node.deleted()));
        int scheduled = 0;
        for (Map.Entry<String, List<Subscription>> e : byPrefix.entrySet()) {
            if (!node.key().startsWith(e.getKey())) {
                continue;
            }
            for (Subscription sub : e.getValue()) {
                scheduler.schedule(() -> sub.callback().accept(update));
                scheduled++;
            }
        }
        return scheduled;
    }

    /**
     * Remove the subscription with this id.
     *
     * @return true if it was registered, false if already gone
     * @throws IllegalStateException if more than one registration carries the id
     */
    public boolean cancel(long id) {
        boolean found = false;
        for (Iterator<List<Subscription>> lists = byPrefix.values().iterator(); lists.hasNext(); ) {
            List<Subscription> subs = lists.next();
            for (Iterator<Subscription> it = subs.iterator(); it.hasNext(); ) {
                if (it.next().id() == id) {
                    if (found) {
                        throw new IllegalStateException("subscription " + id + " registered twice");
                    }
                    found = true;
                    it.remove();
                }
            }
            if (subs.isEmpty()) {
                lists.remove();
            }
        }
        return found;
    }

    /** Number of live subscriptions. */
    public int size() {
        int n = 0;
        for (List<Subscription> subs : byPrefix.values()) {
            n += subs.size();
        }
        return n;
    }

    private record Subscription(long id, Consumer<List<WatchUpdate>> callback) {}
}
