// file: storage/src/main/java/io/etcdlite/storage/PreconditionChecker.java
package io.etcdlite.storage;

import io.etcdlite.core.Node;
import io.etcdlite.core.Status;

import java.util.Map;

/**
 * Compare-and-swap checks for conditional writes and deletes.
 * <p>
 * Parameters:
 *  - prevExist=false: the key must be absent.
 *  - prevExist=true:  the key must be present.
 *  - prevIndex=N:     the key must be present with modifiedIndex == N.
 * Without either parameter the check always passes. Must be called under the
 * same lock as the mutation it guards.
 */
public final class PreconditionChecker {

    public static final String PREV_EXIST = "prevExist";
    public static final String PREV_INDEX = "prevIndex";

    private final EntryTable table;

    public PreconditionChecker(EntryTable table) {
        this.table = table;
    }

    /**
     * @return {@link Status#OK}, or a FAILED_PRECONDITION status naming the
     *         condition that did not hold
     * @throws IllegalArgumentException for malformed parameter values
     */
    public Status check(String key, Map<String, String> params) {
        Node existing = table.get(key);
        boolean exists = existing != null;

        String prevExist = params.get(PREV_EXIST);
        if (prevExist != null) {
            switch (prevExist) {
                case "false" -> {
                    if (exists) {
                        return Status.failedPrecondition(key + " Already exists");
                    }
                }
                case "true" -> {
                    if (!exists) {
                        return Status.failedPrecondition(key + " Not found");
                    }
                }
                default -> throw new IllegalArgumentException(
                        "prevExist must be \"true\" or \"false\", got: " + prevExist);
            }
        }

        String prevIndex = params.get(PREV_INDEX);
        if (prevIndex != null) {
            long expected = parseIndex(prevIndex);
            if (!exists) {
                return Status.failedPrecondition("Node doesn't exist: " + key);
            }
            if (existing.modifiedIndex() != expected) {
                return Status.failedPrecondition("Incorrect index: prevIndex=" + expected
                        + " but modifiedIndex=" + existing.modifiedIndex());
            }
        }
        return Status.OK;
    }

    private static long parseIndex(String raw) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("prevIndex must be a decimal index, got: " + raw, e);
        }
    }
}
