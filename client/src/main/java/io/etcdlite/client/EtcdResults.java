// file: client/src/main/java/io/etcdlite/client/EtcdResults.java
package io.etcdlite.client;

import io.etcdlite.core.Node;

import java.util.List;

/**
 * Typed results of {@link EtcdClient} calls.
 */
public final class EtcdResults {

    private EtcdResults() {
        // namespace
    }

    /** Single entry read. */
    public record GetResult(long etcdIndex, Node node) {}

    /** Directory listing, ordered by key. */
    public record GetAllResult(long etcdIndex, List<Node> nodes) {}

    /** Successful create/set/delete; {@code node} is the entry as the store rendered it. */
    public record WriteResult(long etcdIndex, Node node) {}

    /** New queue entry created under a directory. */
    public record QueueResult(long etcdIndex, String key) {}
}
