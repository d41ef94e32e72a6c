// file: storage/src/main/java/io/etcdlite/storage/StoreConfig.java
package io.etcdlite.storage;

import java.time.Clock;
import java.util.Objects;

/**
 * Store configuration.
 *
 * Supports:
 *  - clock:        time source for TTL expiry (swap in a fixed/mutable clock in tests)
 *  - dumpEntries:  log every entry at FINE after each request
 */
public record StoreConfig(Clock clock, boolean dumpEntries) {

    public StoreConfig {
        Objects.requireNonNull(clock, "clock");
    }

    /** System UTC clock, no entry dumps. */
    public static StoreConfig defaults() {
        return new StoreConfig(Clock.systemUTC(), false);
    }

    public StoreConfig withClock(Clock clock) {
        return new StoreConfig(clock, dumpEntries);
    }

    public StoreConfig withDumpEntries(boolean dumpEntries) {
        return new StoreConfig(clock, dumpEntries);
    }
}
