// file: core/src/main/java/io/etcdlite/core/StatusCode.java
package io.etcdlite.core;

/**
 * Outcome codes reported by the store.
 * <p>
 * Only runtime conditions get a code. Caller bugs (bad key shape, missing
 * value, unknown parameter values) are thrown as exceptions instead.
 */
public enum StatusCode {
    OK,
    /** Read of a leaf key that does not exist. */
    NOT_FOUND,
    /** A prevExist / prevIndex condition did not hold. */
    FAILED_PRECONDITION,
    /** A watch was torn down through its task. */
    CANCELLED
}
