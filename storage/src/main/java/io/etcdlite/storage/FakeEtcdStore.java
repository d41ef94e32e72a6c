// file: storage/src/main/java/io/etcdlite/storage/FakeEtcdStore.java
package io.etcdlite.storage;

import io.etcdlite.core.Node;
import io.etcdlite.core.NodeJson;
import io.etcdlite.core.Response;
import io.etcdlite.core.Scheduler;
import io.etcdlite.core.Status;
import io.etcdlite.core.Verb;
import io.etcdlite.core.WatchTask;
import io.etcdlite.core.WatchUpdate;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.DateTimeException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-memory stand-in for an etcd v2 style coordination service.
 * <p>
 * Responsibilities:
 *  - Own the entry table, the version counter and the watch registry.
 *  - Dispatch generic requests (GET/POST/PUT/DELETE) to their handlers.
 *  - Run the expiry sweep before every request.
 *  - Deliver every response and watch notification through the injected
 *    {@link Scheduler}, never on the caller's stack.
 * <p>
 * Ordering:
 *  - Handlers hold one lock for their whole critical section, including the
 *    precondition check and the scheduling of callbacks.
 *  - A mutation schedules its own response first, then its watch
 *    notifications, so the writer sees its result no later than any watcher.
 * <p>
 * Reported indexes:
 *  - A written entry carries the counter value from before the write; the
 *    response carries the counter after it, one higher.
 *  - A delete response renders the tombstone with the modifiedIndex it had
 *    before the delete; the delete's own version is only visible as the
 *    response index.
 * <p>
 * Caller bugs (directory key for a leaf verb, missing value, malformed
 * parameters) throw synchronously and leave the table untouched.
 */
public final class FakeEtcdStore {
    private static final Logger log = Logger.getLogger(FakeEtcdStore.class.getName());

    public static final String VALUE = "value";
    public static final String TTL = "ttl";

    private final Object lock = new Object();
    private final Scheduler scheduler;
    private final StoreConfig config;
    private final EntryTable table = new EntryTable();
    private final WatchRegistry watches;
    private final PreconditionChecker preconditions;
    private final ExpirySweeper sweeper;

    public FakeEtcdStore(Scheduler scheduler) {
        this(scheduler, StoreConfig.defaults());
    }

    public FakeEtcdStore(Scheduler scheduler, StoreConfig config) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.config = Objects.requireNonNull(config, "config");
        this.watches = new WatchRegistry(scheduler);
        this.preconditions = new PreconditionChecker(table);
        this.sweeper = new ExpirySweeper(table, watches);
    }

    /**
     * Handle one request.
     *
     * @param key      leaf key, or directory key ending in '/' (GET and POST only)
     * @param params   optional value / ttl / prevExist / prevIndex
     * @param verb     request verb
     * @param callback receives the response, later, on the scheduler
     */
    public void generic(String key, Map<String, String> params, Verb verb, Consumer<Response> callback) {
        requireKey(key);
        Objects.requireNonNull(params, "params");
        Objects.requireNonNull(verb, "verb");
        Objects.requireNonNull(callback, "callback");

        purgeExpiredEntries();
        switch (verb) {
            case GET -> handleGet(key, callback);
            case POST -> handlePost(key, params, callback);
            case PUT -> handlePut(key, params, callback);
            case DELETE -> handleDelete(key, params, callback);
        }
        dumpEntries();
    }

    /**
     * Start watching every key that starts with {@code prefix}.
     * <p>
     * The callback first receives one snapshot of all matching entries (possibly
     * empty), then one single-element list per later change. Cancelling
     * {@code task} removes the subscription and resolves the task with
     * {@link Status#CANCELLED}.
     *
     * @return the subscription id, also attached to {@code task}
     */
    public long watch(String prefix, Consumer<List<WatchUpdate>> callback, WatchTask task) {
        Objects.requireNonNull(prefix, "prefix");
        Objects.requireNonNull(callback, "callback");
        Objects.requireNonNull(task, "task");

        purgeExpiredEntries();
        long id;
        synchronized (lock) {
            id = watches.allocateId();
            task.attach(id);
            List<WatchUpdate> initial = table.list(prefix).stream()
                    .map(n -> new WatchUpdate(n, true))
                    .toList();
            scheduler.schedule(() -> callback.accept(initial));
            watches.register(id, prefix, callback);
        }
        log.fine(() -> "WATCH " + prefix + " -> subscription " + id);
        task.whenCancelled(() -> cancelWatch(id, task));
        return id;
    }

    /** Current store index. */
    public long index() {
        synchronized (lock) {
            return table.index();
        }
    }

    /** Number of live watch subscriptions. */
    public int watchCount() {
        synchronized (lock) {
            return watches.size();
        }
    }

    // ---------- handlers ----------

    private void handleGet(String key, Consumer<Response> cb) {
        log.fine(() -> "GET " + key);
        synchronized (lock) {
            if (isDirectory(key)) {
                ObjectNode body = NodeJson.directory(table.list(key), "get");
                respond(cb, new Response(Status.OK, body, table.index()));
                return;
            }
            Node node = table.get(key);
            if (node == null) {
                respond(cb, new Response(Status.notFound("not found"), NodeJson.empty(), table.index()));
            } else {
                respond(cb, new Response(Status.OK, NodeJson.entry(node, "get"), table.index()));
            }
        }
    }

    private void handlePost(String key, Map<String, String> params, Consumer<Response> cb) {
        log.fine(() -> "POST " + key);
        String value = requireValue(params, Verb.POST);
        synchronized (lock) {
            Instant expiresAt = expiryFrom(params);
            String path = ensureEndsWithSlash(key) + table.nextVersion();
            Node node = table.put(path, value, expiresAt);
            long index = table.advance();
            respond(cb, new Response(Status.OK, NodeJson.entry(node, "create"), index));
            watches.notifyFor(node);
        }
    }

    private void handlePut(String key, Map<String, String> params, Consumer<Response> cb) {
        log.fine(() -> "PUT " + key);
        requireLeaf(key, Verb.PUT);
        String value = requireValue(params, Verb.PUT);
        synchronized (lock) {
            Instant expiresAt = expiryFrom(params);
            Status status = preconditions.check(key, params);
            if (!status.ok()) {
                respond(cb, new Response(status, NodeJson.empty(), table.index()));
                return;
            }
            Node node = table.put(key, value, expiresAt);
            long index = table.advance();
            respond(cb, new Response(Status.OK, NodeJson.entry(node, "set"), index));
            watches.notifyFor(node);
        }
    }

    private void handleDelete(String key, Map<String, String> params, Consumer<Response> cb) {
        log.fine(() -> "DELETE " + key);
        requireLeaf(key, Verb.DELETE);
        synchronized (lock) {
            Status status = preconditions.check(key, params);
            if (!status.ok()) {
                respond(cb, new Response(status, NodeJson.empty(), table.index()));
                return;
            }
            if (!table.contains(key)) {
                respond(cb, new Response(Status.notFound(key + " not found"), NodeJson.empty(), table.index()));
                return;
            }
            Node tombstone = table.markDeleted(key);
            long index = table.advance();
            respond(cb, new Response(Status.OK, NodeJson.entry(tombstone, "delete"), index));
            watches.notifyFor(tombstone);
            table.erase(key);
        }
    }

    private void cancelWatch(long id, WatchTask task) {
        synchronized (lock) {
            if (!watches.cancel(id)) {
                return;
            }
            log.fine(() -> "Removing watcher " + id);
            scheduler.schedule(() -> task.complete(Status.CANCELLED));
        }
    }

    // ---------- helpers ----------

    private void purgeExpiredEntries() {
        synchronized (lock) {
            sweeper.purge(config.clock().instant());
        }
    }

    private void respond(Consumer<Response> cb, Response response) {
        scheduler.schedule(() -> cb.accept(response));
    }

    private Instant expiryFrom(Map<String, String> params) {
        String ttl = params.get(TTL);
        if (ttl == null) {
            return null;
        }
        long seconds;
        try {
            seconds = Long.parseLong(ttl);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("ttl must be a number of seconds, got: " + ttl, e);
        }
        if (seconds < 0) {
            throw new IllegalArgumentException("ttl must not be negative, got: " + ttl);
        }
        try {
            return config.clock().instant().plusSeconds(seconds);
        } catch (ArithmeticException | DateTimeException e) {
            throw new IllegalArgumentException("ttl out of range, got: " + ttl, e);
        }
    }

    private void dumpEntries() {
        if (!config.dumpEntries() || !log.isLoggable(Level.FINE)) {
            return;
        }
        List<Node> all;
        synchronized (lock) {
            all = table.all();
        }
        for (Node n : all) {
            log.fine(n.toString());
        }
    }

    private static String requireValue(Map<String, String> params, Verb verb) {
        String value = params.get(VALUE);
        if (value == null) {
            throw new IllegalArgumentException(verb + " requires a '" + VALUE + "' parameter");
        }
        return value;
    }

    private static void requireKey(String key) {
        Objects.requireNonNull(key, "key");
        if (key.isEmpty()) {
            throw new IllegalArgumentException("key must not be empty");
        }
    }

    private static void requireLeaf(String key, Verb verb) {
        if (isDirectory(key)) {
            throw new IllegalArgumentException(verb + " needs a leaf key, got directory " + key);
        }
    }

    private static boolean isDirectory(String key) {
        return key.endsWith("/");
    }

    private static String ensureEndsWithSlash(String key) {
        return isDirectory(key) ? key : key + '/';
    }
}
