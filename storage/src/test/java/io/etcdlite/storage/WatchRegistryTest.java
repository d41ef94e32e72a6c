// file: storage/src/test/java/io/etcdlite/storage/WatchRegistryTest.java
package io.etcdlite.storage;

import io.etcdlite.core.ManualScheduler;
import io.etcdlite.core.Node;
import io.etcdlite.core.WatchUpdate;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WatchRegistryTest {

    @Test
    void notifies_every_matching_prefix_and_no_others() {
        var s = new ManualScheduler();
        var r = new WatchRegistry(s);
        List<String> seen = new ArrayList<>();

        r.register("/", u -> seen.add("root"));
        r.register("/ab", u -> seen.add("ab"));
        r.register("/ab", u -> seen.add("ab-2"));
        r.register("/abc/", u -> seen.add("abc-dir"));
        r.register("/x", u -> seen.add("x"));

        int scheduled = r.notifyFor(Node.live("/abc", "v", 1, 1));

        assertEquals(3, scheduled);
        assertTrue(seen.isEmpty(), "notifications are only enqueued");
        s.runPending();
        assertEquals(List.of("root", "ab", "ab-2"), seen);
    }

    @Test
    void update_reports_exists_from_tombstone_flag() {
        var s = new ManualScheduler();
        var r = new WatchRegistry(s);
        List<WatchUpdate> got = new ArrayList<>();
        r.register("/a", got::addAll);

        Node live = Node.live("/a", "v", 1, 1);
        r.notifyFor(live);
        r.notifyFor(live.asTombstone());
        s.runPending();

        assertEquals(2, got.size());
        assertTrue(got.get(0).exists());
        assertFalse(got.get(1).exists());
        assertTrue(got.get(1).node().deleted());
    }

    @Test
    void cancel_removes_only_that_subscription_and_is_idempotent() {
        var s = new ManualScheduler();
        var r = new WatchRegistry(s);
        List<String> seen = new ArrayList<>();
        long first = r.register("/a", u -> seen.add("first"));
        long second = r.register("/a", u -> seen.add("second"));
        assertNotEquals(first, second);

        assertTrue(r.cancel(first));
        assertFalse(r.cancel(first));
        assertEquals(1, r.size());

        r.notifyFor(Node.live("/a", "v", 1, 1));
        s.runPending();
        assertEquals(List.of("second"), seen);
    }
}
