package forgebench.orchestrator.repository;

import java.util.function.Supplier;

/**
 * Named, timeout-bounded mutual exclusion shared by every process using the
 * same store.
 */
public interface DistributedLock {

    /**
     * Run an action while holding the named lock. If the lock cannot be
     * acquired within the wait timeout the action runs anyway.
     *
     * @param name   lock name
     * @param action the work to run
     * @return the action's result
     */
    <T> T withLock(String name, Supplier<T> action);

    /**
     * Try to take the named lock once.
     *
     * @return the owner token, or null if another owner holds an unexpired lease
     */
    String tryAcquire(String name);

    /**
     * Release a lock held by the given owner. A lock taken over by someone
     * else after expiry is left alone.
     */
    void release(String name, String owner);
}
