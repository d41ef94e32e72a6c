// file: core/src/main/java/io/etcdlite/core/WatchUpdate.java
package io.etcdlite.core;

import java.util.Objects;

/**
 * One change delivered to a watcher.
 *
 * @param node   the entry as it was at notification time (a tombstone for deletions)
 * @param exists false when the entry was deleted or expired
 */
public record WatchUpdate(Node node, boolean exists) {
    public WatchUpdate {
        Objects.requireNonNull(node, "node");
    }
}
