package io.fragment.engine.core;

import java.util.concurrent.atomic.AtomicLong;

/**
 * No-op WindowService for headless and CI environments.
 *
 * Has no window and no events; every update succeeds. The frame counter makes
 * it usable as a probe in tests.
 */
public final class HeadlessWindowService implements WindowService {

    private final AtomicLong updates = new AtomicLong(0L);

    @Override
    public boolean update() {
        updates.incrementAndGet();
        return true;
    }

    /** Number of update() calls so far. */
    public long updateCount() { return updates.get(); }
}
