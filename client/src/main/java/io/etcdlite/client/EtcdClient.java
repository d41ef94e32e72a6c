// file: client/src/main/java/io/etcdlite/client/EtcdClient.java
package io.etcdlite.client;

import io.etcdlite.client.EtcdResults.GetAllResult;
import io.etcdlite.client.EtcdResults.GetResult;
import io.etcdlite.client.EtcdResults.QueueResult;
import io.etcdlite.client.EtcdResults.WriteResult;
import io.etcdlite.core.NodeJson;
import io.etcdlite.core.Response;
import io.etcdlite.core.Verb;
import io.etcdlite.core.WatchTask;
import io.etcdlite.core.WatchUpdate;
import io.etcdlite.storage.FakeEtcdStore;
import io.etcdlite.storage.PreconditionChecker;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Typed, future-based facade over {@link FakeEtcdStore#generic}.
 * <p>
 * Each call builds the parameter map the generic request expects and turns the
 * response document back into typed results. A non-OK status completes the
 * future exceptionally with {@link EtcdException}. Futures complete on the
 * store's scheduler.
 * <p>
 * Semantics of the write helpers:
 *  - create:    prevExist=false (fails if the key exists)
 *  - update:    prevIndex=N (fails unless the key is at modifiedIndex N)
 *  - forceSet:  unconditional write
 *  - delete:    prevIndex=N; forceDelete is unconditional
 */
public final class EtcdClient {

    private final FakeEtcdStore store;

    public EtcdClient(FakeEtcdStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    public CompletableFuture<GetResult> get(String key) {
        return call(key, Map.of(), Verb.GET,
                r -> new GetResult(r.index(), NodeJson.parseNode(r.body().path("node"))));
    }

    /** List a directory; {@code dir} gets a trailing '/' if it lacks one. */
    public CompletableFuture<GetAllResult> getAll(String dir) {
        String key = dir.endsWith("/") ? dir : dir + "/";
        return call(key, Map.of(), Verb.GET,
                r -> new GetAllResult(r.index(), NodeJson.parseChildren(r.body().path("node"))));
    }

    public CompletableFuture<WriteResult> create(String key, String value) {
        return write(key, params(value, null, PreconditionChecker.PREV_EXIST, "false"), Verb.PUT);
    }

    public CompletableFuture<WriteResult> createWithTtl(String key, String value, Duration ttl) {
        return write(key, params(value, ttl, PreconditionChecker.PREV_EXIST, "false"), Verb.PUT);
    }

    /** Append a value under {@code dir} with a generated, index-based key. */
    public CompletableFuture<QueueResult> createInQueue(String dir, String value) {
        return call(dir, params(value, null, null, null), Verb.POST,
                r -> new QueueResult(r.index(), r.body().path("node").path("key").asText()));
    }

    public CompletableFuture<WriteResult> update(String key, String value, long prevIndex) {
        return write(key, params(value, null, PreconditionChecker.PREV_INDEX, Long.toString(prevIndex)), Verb.PUT);
    }

    public CompletableFuture<WriteResult> updateWithTtl(String key, String value, long prevIndex, Duration ttl) {
        return write(key, params(value, ttl, PreconditionChecker.PREV_INDEX, Long.toString(prevIndex)), Verb.PUT);
    }

    public CompletableFuture<WriteResult> forceSet(String key, String value) {
        return write(key, params(value, null, null, null), Verb.PUT);
    }

    public CompletableFuture<WriteResult> forceSetWithTtl(String key, String value, Duration ttl) {
        return write(key, params(value, ttl, null, null), Verb.PUT);
    }

    public CompletableFuture<WriteResult> delete(String key, long currentIndex) {
        return write(key, params(null, null, PreconditionChecker.PREV_INDEX, Long.toString(currentIndex)), Verb.DELETE);
    }

    public CompletableFuture<WriteResult> forceDelete(String key) {
        return write(key, Map.of(), Verb.DELETE);
    }

    /**
     * Watch every key under {@code prefix}. The listener gets the initial
     * snapshot first, then one update list per change.
     *
     * @return the handle; cancel it to stop watching
     */
    public WatchTask watch(String prefix, Consumer<List<WatchUpdate>> listener) {
        WatchTask task = new WatchTask();
        store.watch(prefix, listener, task);
        return task;
    }

    // ---------- helpers ----------

    private CompletableFuture<WriteResult> write(String key, Map<String, String> params, Verb verb) {
        return call(key, params, verb,
                r -> new WriteResult(r.index(), NodeJson.parseNode(r.body().path("node"))));
    }

    private <T> CompletableFuture<T> call(String key, Map<String, String> params, Verb verb,
                                          Function<Response, T> onOk) {
        CompletableFuture<T> out = new CompletableFuture<>();
        store.generic(key, params, verb, r -> {
            if (!r.status().ok()) {
                out.completeExceptionally(new EtcdException(r.status(), r.index()));
                return;
            }
            try {
                out.complete(onOk.apply(r));
            } catch (RuntimeException e) {
                out.completeExceptionally(e);
            }
        });
        return out;
    }

    private static Map<String, String> params(String value, Duration ttl, String condition, String expected) {
        Map<String, String> p = new HashMap<>();
        if (value != null) {
            p.put(FakeEtcdStore.VALUE, value);
        }
        if (ttl != null) {
            p.put(FakeEtcdStore.TTL, Long.toString(ttl.toSeconds()));
        }
        if (condition != null) {
            p.put(condition, expected);
        }
        return p;
    }
}
