// file: storage/src/main/java/io/etcdlite/storage/EntryTable.java
package io.etcdlite.storage;

import io.etcdlite.core.Node;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Authoritative key -> entry mapping plus the global version counter.
 * <p>
 * Versioning:
 *  - The counter starts at 1 and only ever moves up, via {@link #advance()}.
 *  - A write stamps the entry with the counter's current value
 *    ({@link #nextVersion()}); the caller then advances once per completed
 *    write. The index reported to the caller is the post-advance value, one
 *    higher than the stamp on the entry just written.
 *  - Overwriting a key keeps its original createdIndex.
 * <p>
 * Not thread safe: every call happens under the owning store's lock.
 */
public final class EntryTable {

    private final NavigableMap<String, Node> entries = new TreeMap<>();
    private long index = 1;

    /** Current counter value; also the stamp the next write will carry. */
    public long nextVersion() {
        return index;
    }

    /** Store index as reported in responses. */
    public long index() {
        return index;
    }

    /** Count one completed write and return the new counter value. */
    public long advance() {
        return ++index;
    }

    /** Entry for the key, or null if absent. */
    public Node get(String key) {
        return entries.get(key);
    }

    public boolean contains(String key) {
        return entries.containsKey(key);
    }

    /** All entries whose key starts with {@code prefix}, ordered by key. */
    public List<Node> list(String prefix) {
        List<Node> out = new ArrayList<>();
        for (Map.Entry<String, Node> e : entries.tailMap(prefix, true).entrySet()) {
            if (!e.getKey().startsWith(prefix)) {
                break;
            }
            out.add(e.getValue());
        }
        return out;
    }

    /**
     * Write a live entry stamped with {@link #nextVersion()}.
     *
     * @param expiresAt absolute expiry, or null for none
     * @return the entry as stored
     */
    public Node put(String key, String value, Instant expiresAt) {
        long stamp = nextVersion();
        Node existing = entries.get(key);
        long created = existing == null ? stamp : existing.createdIndex();
        Node node = new Node(key, value, created, stamp, expiresAt, false);
        entries.put(key, node);
        return node;
    }

    /**
     * Flag an existing entry as a tombstone, leaving it in the table.
     *
     * @return the tombstoned entry
     * @throws IllegalStateException if the key is absent
     */
    public Node markDeleted(String key) {
        Node existing = entries.get(key);
        if (existing == null) {
            throw new IllegalStateException("cannot tombstone missing key " + key);
        }
        Node tombstone = existing.asTombstone();
        entries.put(key, tombstone);
        return tombstone;
    }

    /** Remove the entry outright. */
    public void erase(String key) {
        entries.remove(key);
    }

    /** Keys whose expiry lies strictly before {@code now}, in key order. */
    public List<String> expiredKeys(Instant now) {
        List<String> out = new ArrayList<>();
        for (Node n : entries.values()) {
            if (n.expiredAt(now)) {
                out.add(n.key());
            }
        }
        return out;
    }

    /** All entries in key order. */
    public List<Node> all() {
        return List.copyOf(entries.values());
    }

    public int size() {
        return entries.size();
    }
}
