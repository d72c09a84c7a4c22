package io.fragment.engine.resources;

import io.fragment.engine.api.EngineLogger;
import io.fragment.engine.api.LogSeverity;
import io.fragment.engine.api.ResourceDescriptor;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Key to descriptor index of all discovered resources.
 *
 * SWAP MODEL:
 *   The index starts empty and is only ever replaced as a whole, by
 *   {@link #replaceAll(Map)} at the end of a successful scan. The clear and
 *   the bulk insert happen inside one write-lock critical section, so readers
 *   observe either the complete old contents or the complete new contents.
 *
 * THREAD SAFETY:
 *   All access goes through a fair ReentrantReadWriteLock acquired with a
 *   bounded wait. A timed-out lookup reports "not found"; a timed-out
 *   replacement leaves the old contents authoritative. Both are logged.
 */
public final class ResourceIndex {

    private final EngineLogger logger;
    private final long lockTimeoutMs;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);
    private final Map<String, ResourceDescriptor> descriptors = new HashMap<>();

    private volatile int size = 0;
    private volatile long generation = 0L;

    /**
     * @param logger        receives lock timeout reports
     * @param lockTimeoutMs bounded wait for every lock acquisition; must be > 0
     */
    public ResourceIndex(EngineLogger logger, long lockTimeoutMs) {
        if (logger == null) throw new NullPointerException("logger");
        if (lockTimeoutMs <= 0) {
            throw new IllegalArgumentException("lockTimeoutMs must be > 0, got " + lockTimeoutMs);
        }
        this.logger = logger;
        this.lockTimeoutMs = lockTimeoutMs;
    }

    /**
     * Looks up a descriptor by key.
     *
     * @return the descriptor, or empty if absent or the read lock timed out
     */
    public Optional<ResourceDescriptor> lookup(String key) {
        if (key == null) throw new NullPointerException("key");
        if (!acquire(lock.readLock(), "lookup of '" + key + "'")) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(descriptors.get(key));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Immutable copy of the whole index, taken under the read lock.
     * Empty if the read lock timed out.
     */
    public Map<String, ResourceDescriptor> snapshot() {
        if (!acquire(lock.readLock(), "snapshot")) {
            return Map.of();
        }
        try {
            return Map.copyOf(descriptors);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Replaces the whole index with {@code replacement}.
     *
     * @return false if the write lock could not be acquired in time;
     *         the previous contents then remain in place
     */
    public boolean replaceAll(Map<String, ResourceDescriptor> replacement) {
        if (replacement == null) throw new NullPointerException("replacement");
        if (!acquire(lock.writeLock(), "replacement")) {
            return false;
        }
        try {
            descriptors.clear();
            descriptors.putAll(replacement);
            size = descriptors.size();
            generation++;
        } finally {
            lock.writeLock().unlock();
        }
        return true;
    }

    /** Number of descriptors in the current contents. */
    public int size() { return size; }

    /** Incremented on every successful replacement. */
    public long generation() { return generation; }

    public long lockTimeoutMs() { return lockTimeoutMs; }

    private boolean acquire(Lock l, String operation) {
        try {
            if (l.tryLock(lockTimeoutMs, TimeUnit.MILLISECONDS)) {
                return true;
            }
            logger.logError("Resource index " + operation + " timed out after "
                + lockTimeoutMs + " ms", LogSeverity.HIGH);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.logException("Resource index " + operation + " interrupted", e, LogSeverity.HIGH);
        }
        return false;
    }
}
