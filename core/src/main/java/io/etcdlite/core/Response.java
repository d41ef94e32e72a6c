// file: core/src/main/java/io/etcdlite/core/Response.java
package io.etcdlite.core;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * Result of one generic request.
 *
 * @param status outcome of the request
 * @param body   response document; an empty object when the status is not OK
 * @param index  store index after the request was applied
 */
public record Response(Status status, ObjectNode body, long index) {
    public Response {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(body, "body");
    }
}
