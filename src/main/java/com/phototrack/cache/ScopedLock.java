package com.phototrack.cache;

import java.time.Duration;

/**
 * Exclusive lock with a bounded wait. {@link #close()} releases it, so callers
 * hold it in try-with-resources and every exit path lets go.
 */
public interface ScopedLock extends AutoCloseable {

    /**
     * @return false when the lock could not be obtained within the timeout
     */
    boolean acquire(Duration timeout);

    boolean isHeld();

    void release();

    @Override
    default void close() {
        release();
    }
}
