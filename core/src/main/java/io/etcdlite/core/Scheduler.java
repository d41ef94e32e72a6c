// file: core/src/main/java/io/etcdlite/core/Scheduler.java
package io.etcdlite.core;

/**
 * Deferred execution capability borrowed by the store.
 * <p>
 * Contract:
 *  - schedule() only enqueues; it never runs the task on the caller's stack.
 *  - Tasks run strictly in enqueue order and never concurrently with each other.
 */
@FunctionalInterface
public interface Scheduler {

    void schedule(Runnable task);
}
