// file: core/src/main/java/io/etcdlite/core/Status.java
package io.etcdlite.core;

import java.util.Objects;

/**
 * Result status of a store operation: a code plus a human-readable reason.
 */
public record Status(StatusCode code, String message) {

    public static final Status OK = new Status(StatusCode.OK, "");
    public static final Status CANCELLED = new Status(StatusCode.CANCELLED, "cancelled");

    public Status {
        Objects.requireNonNull(code, "code");
        message = message == null ? "" : message;
    }

    public static Status notFound(String message) {
        return new Status(StatusCode.NOT_FOUND, message);
    }

    public static Status failedPrecondition(String message) {
        return new Status(StatusCode.FAILED_PRECONDITION, message);
    }

    public boolean ok() { return code == StatusCode.OK; }

    @Override
    public String toString() {
        return message.isEmpty() ? code.name() : code + ": " + message;
    }
}
