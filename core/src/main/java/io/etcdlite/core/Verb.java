// file: core/src/main/java/io/etcdlite/core/Verb.java
package io.etcdlite.core;

/**
 * Request verbs understood by the store, named after the HTTP methods the
 * real service maps them to.
 */
public enum Verb {
    /** Read a leaf, or list a directory when the key ends with '/'. */
    GET,
    /** Create a new leaf with a generated name under a directory. */
    POST,
    /** Conditional write of a leaf. */
    PUT,
    /** Conditional delete of a leaf. */
    DELETE
}
