// file: client/src/test/java/io/etcdlite/client/EtcdClientTest.java
package io.etcdlite.client;

import io.etcdlite.client.EtcdResults.GetAllResult;
import io.etcdlite.client.EtcdResults.GetResult;
import io.etcdlite.client.EtcdResults.QueueResult;
import io.etcdlite.client.EtcdResults.WriteResult;
import io.etcdlite.core.ManualScheduler;
import io.etcdlite.core.SerialScheduler;
import io.etcdlite.core.StatusCode;
import io.etcdlite.core.WatchTask;
import io.etcdlite.core.WatchUpdate;
import io.etcdlite.storage.FakeEtcdStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class EtcdClientTest {

    private ManualScheduler scheduler;
    private EtcdClient client;

    @BeforeEach
    void setUp() {
        scheduler = new ManualScheduler();
        client = new EtcdClient(new FakeEtcdStore(scheduler));
    }

    private <T> T await(CompletableFuture<T> f) {
        scheduler.runPending();
        assertTrue(f.isDone());
        return f.join();
    }

    private EtcdException failure(CompletableFuture<?> f) {
        scheduler.runPending();
        CompletionException e = assertThrows(CompletionException.class, f::join);
        return assertInstanceOf(EtcdException.class, e.getCause());
    }

    @Test
    void create_then_get_round_trips_the_node() {
        WriteResult created = await(client.create("/a", "v1"));
        GetResult read = await(client.get("/a"));

        assertEquals("/a", created.node().key());
        assertEquals(2, created.etcdIndex());
        assertEquals("v1", read.node().value());
        assertEquals(created.node().modifiedIndex(), read.node().modifiedIndex());
    }

    @Test
    void create_fails_when_key_exists() {
        await(client.create("/a", "v1"));

        EtcdException e = failure(client.create("/a", "v2"));

        assertEquals(StatusCode.FAILED_PRECONDITION, e.code());
        assertEquals("v1", await(client.get("/a")).node().value());
    }

    @Test
    void get_missing_key_fails_not_found() {
        assertEquals(StatusCode.NOT_FOUND, failure(client.get("/missing")).code());
    }

    @Test
    void update_is_compare_and_swap_on_modified_index() {
        WriteResult first = await(client.create("/a", "v1"));
        long m = first.node().modifiedIndex();

        WriteResult second = await(client.update("/a", "v2", m));
        assertEquals(first.node().createdIndex(), second.node().createdIndex());

        EtcdException stale = failure(client.update("/a", "v3", m));
        assertEquals(StatusCode.FAILED_PRECONDITION, stale.code());
        assertEquals("v2", await(client.get("/a")).node().value());
    }

    @Test
    void force_set_and_force_delete_are_unconditional() {
        await(client.forceSet("/a", "v1"));
        await(client.forceSet("/a", "v2"));

        WriteResult deleted = await(client.forceDelete("/a"));

        assertTrue(deleted.node().deleted());
        assertEquals(StatusCode.NOT_FOUND, failure(client.get("/a")).code());
    }

    @Test
    void delete_requires_current_index() {
        WriteResult w = await(client.forceSet("/a", "v"));

        assertEquals(StatusCode.FAILED_PRECONDITION,
                failure(client.delete("/a", w.node().modifiedIndex() + 1)).code());
        await(client.delete("/a", w.node().modifiedIndex()));
    }

    @Test
    void queue_entries_are_listed_in_creation_order() {
        QueueResult q1 = await(client.createInQueue("/q", "first"));
        QueueResult q2 = await(client.createInQueue("/q/", "second"));

        GetAllResult all = await(client.getAll("/q"));

        assertEquals(List.of(q1.key(), q2.key()), all.nodes().stream().map(n -> n.key()).toList());
        assertEquals(List.of("first", "second"), all.nodes().stream().map(n -> n.value()).toList());
        assertEquals(q2.etcdIndex(), all.etcdIndex());
    }

    @Test
    void ttl_variants_pass_ttl_through() {
        WriteResult w = await(client.createWithTtl("/t", "v", Duration.ofSeconds(30)));
        await(client.updateWithTtl("/t", "w", w.node().modifiedIndex(), Duration.ofSeconds(30)));
        await(client.forceSetWithTtl("/t", "x", Duration.ofSeconds(30)));

        assertEquals("x", await(client.get("/t")).node().value());
    }

    @Test
    void watch_delivers_snapshot_then_changes_until_cancelled() {
        await(client.forceSet("/w/a", "1"));
        List<List<WatchUpdate>> got = new ArrayList<>();

        WatchTask task = client.watch("/w/", got::add);
        scheduler.runPending();
        await(client.forceSet("/w/b", "2"));
        task.cancel();
        await(client.forceSet("/w/c", "3"));

        assertEquals(2, got.size());
        assertEquals("/w/a", got.get(0).get(0).node().key());
        assertEquals("/w/b", got.get(1).get(0).node().key());
        assertEquals(StatusCode.CANCELLED, task.result().join().code());
    }

    @Test
    void futures_complete_on_a_real_scheduler_thread_before_watchers_run() throws Exception {
        try (var serial = new SerialScheduler()) {
            var c = new EtcdClient(new FakeEtcdStore(serial));
            List<String> order = Collections.synchronizedList(new ArrayList<>());
            CountDownLatch seen = new CountDownLatch(2);
            c.watch("/x", u -> {
                if (!u.isEmpty()) {
                    order.add("watch");
                    seen.countDown();
                }
            });

            // Hold the worker so the dependent stage is attached before completion.
            CountDownLatch gate = new CountDownLatch(1);
            serial.schedule(() -> {
                try {
                    gate.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            c.forceSet("/x", "v").thenRun(() -> {
                order.add("response");
                seen.countDown();
            });
            gate.countDown();

            assertTrue(seen.await(5, TimeUnit.SECONDS));
            assertEquals(List.of("response", "watch"), order);
        }
    }
}
