// file: core/src/main/java/io/etcdlite/core/Node.java
package io.etcdlite.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of one stored entry.
 * <p>
 * Fields:
 *  - key:           full hierarchical path, unique per entry.
 *  - value:         opaque payload; still carried on a tombstone but not rendered.
 *  - createdIndex:  version stamp from when the key was first created.
 *  - modifiedIndex: version stamp of the most recent write.
 *  - expiresAt:     absolute expiry time, or null for "never".
 *  - deleted:       tombstone flag; only ever true between marking and erasing.
 */
public final class Node {
    private final String key;
    private final String value;
    private final long createdIndex;
    private final long modifiedIndex;
    private final Instant expiresAt;
    private final boolean deleted;

    public Node(String key, String value, long createdIndex, long modifiedIndex,
                Instant expiresAt, boolean deleted) {
        this.key = Objects.requireNonNull(key, "key");
        this.value = value;
        this.createdIndex = createdIndex;
        this.modifiedIndex = modifiedIndex;
        this.expiresAt = expiresAt;
        this.deleted = deleted;
    }

    /** A live node with no expiry. */
    public static Node live(String key, String value, long createdIndex, long modifiedIndex) {
        return new Node(key, value, createdIndex, modifiedIndex, null, false);
    }

    public String key() { return key; }

    public String value() { return value; }

    public long createdIndex() { return createdIndex; }

    public long modifiedIndex() { return modifiedIndex; }

    public Instant expiresAt() { return expiresAt; }

    public boolean deleted() { return deleted; }

    /** True if this node has an expiry strictly before {@code now}. */
    public boolean expiredAt(Instant now) {
        return expiresAt != null && expiresAt.isBefore(now);
    }

    /** Same node with the tombstone flag set. Indexes are left untouched. */
    public Node asTombstone() {
        return new Node(key, value, createdIndex, modifiedIndex, expiresAt, true);
    }


    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Node n)) return false;
        return createdIndex == n.createdIndex
                && modifiedIndex == n.modifiedIndex
                && deleted == n.deleted
                && key.equals(n.key)
                && Objects.equals(value, n.value)
                && Objects.equals(expiresAt, n.expiresAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, value, createdIndex, modifiedIndex, expiresAt, deleted);
    }

    @Override
    public String toString() {
        return "[" + key + ": '" + value + "' c: " + createdIndex + " m: " + modifiedIndex
                + (expiresAt == null ? "" : " e: " + expiresAt)
                + " d: " + deleted + "]";
    }
}
