// file: storage/src/main/java/io/etcdlite/storage/ExpirySweeper.java
package io.etcdlite.storage;

import io.etcdlite.core.Node;

import java.time.Instant;
import java.util.logging.Logger;

/**
 * Lazy TTL enforcement, run once before every request.
 * <p>
 * There is no background timer: an expired entry stays in the table until the
 * next request arrives, and that request's sweep removes it before the request
 * itself is handled. Expiry does not advance the version counter.
 */
public final class ExpirySweeper {
    private static final Logger log = Logger.getLogger(ExpirySweeper.class.getName());

    private final EntryTable table;
    private final WatchRegistry watches;

    public ExpirySweeper(EntryTable table, WatchRegistry watches) {
        this.table = table;
        this.watches = watches;
    }

    /**
     * Tombstone, announce and erase every entry that expired before {@code now}.
     * Must be called under the owning store's lock.
     *
     * @return number of entries purged
     */
    public int purge(Instant now) {
        int purged = 0;
        for (String key : table.expiredKeys(now)) {
            log.fine(() -> "Deleting expired entry " + key);
            Node tombstone = table.markDeleted(key);
            watches.notifyFor(tombstone);
            table.erase(key);
            purged++;
        }
        return purged;
    }
}
