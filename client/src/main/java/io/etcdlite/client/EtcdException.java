// file: client/src/main/java/io/etcdlite/client/EtcdException.java
package io.etcdlite.client;

import io.etcdlite.core.Status;
import io.etcdlite.core.StatusCode;

/**
 * Non-OK outcome of a client call, carrying the store's status and index.
 */
public final class EtcdException extends RuntimeException {
    private final Status status;
    private final long index;

    public EtcdException(Status status, long index) {
        super(status.toString());
        this.status = status;
        this.index = index;
    }

    public Status status() { return status; }

    public StatusCode code() { return status.code(); }

    /** Store index at the time the request was rejected. */
    public long index() { return index; }
}
