package io.fragment.engine.resources;

import io.fragment.engine.api.EngineLogger;
import io.fragment.engine.api.LogSeverity;
import io.fragment.engine.api.ResourceHandle;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.StampedLock;

/**
 * Thread-safe queue of pending load requests, ordered by ascending priority.
 *
 * ORDERING:
 *   Lower priority values are dequeued first. Requests of equal priority are
 *   dequeued in insertion order. A handle is queued at most once; enqueueing a
 *   request for a handle that is already queued is a successful no-op that
 *   keeps the original request and priority.
 *
 * INSERTION:
 *   Cached min/max priorities give O(1) insertion at either end, which covers
 *   the common case of requests arriving with the same priority. Insertion in
 *   the middle is a linear scan; queue depths are small.
 *
 * THREAD SAFETY:
 *   Guarded by a StampedLock. Every acquisition is a bounded wait; a timeout is
 *   logged and the operation reports failure (false / empty). Enqueue checks for
 *   a duplicate under a read lock and converts it to a write lock, re-checking
 *   if the conversion has to fall back to a fresh write lock.
 */
public final class LoadPriorityQueue {

    private final EngineLogger logger;
    private final long lockTimeoutMs;
    private final StampedLock lock = new StampedLock();
    private final List<LoadRequest> entries;

    private int minPriority = ResourceConstants.DEFAULT_LOAD_PRIORITY;
    private int maxPriority = ResourceConstants.DEFAULT_LOAD_PRIORITY;
    private volatile int size = 0;

    public LoadPriorityQueue(EngineLogger logger, long lockTimeoutMs) {
        this(logger, lockTimeoutMs, ResourceConstants.DEFAULT_QUEUE_CAPACITY);
    }

    /**
     * @param logger          receives lock timeout reports
     * @param lockTimeoutMs   bounded wait for every lock acquisition; must be > 0
     * @param initialCapacity initial capacity of the backing list; must be > 0
     */
    public LoadPriorityQueue(EngineLogger logger, long lockTimeoutMs, int initialCapacity) {
        if (logger == null) throw new NullPointerException("logger");
        if (lockTimeoutMs <= 0) {
            throw new IllegalArgumentException("lockTimeoutMs must be > 0, got " + lockTimeoutMs);
        }
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException("initialCapacity must be > 0, got " + initialCapacity);
        }
        this.logger = logger;
        this.lockTimeoutMs = lockTimeoutMs;
        this.entries = new ArrayList<>(initialCapacity);
    }

    // -- Queries --------------------------------------------------------------

    /** True if a request for {@code handle} is queued. False on lock timeout. */
    public boolean contains(ResourceHandle handle) {
        if (handle == null) throw new NullPointerException("handle");
        long stamp = readLock("contains");
        if (stamp == 0L) return false;
        try {
            return indexOf(handle) >= 0;
        } finally {
            lock.unlockRead(stamp);
        }
    }

    /** The queued request for {@code handle}, if any. Empty on lock timeout. */
    public Optional<LoadRequest> peekByHandle(ResourceHandle handle) {
        if (handle == null) throw new NullPointerException("handle");
        long stamp = readLock("peekByHandle");
        if (stamp == 0L) return Optional.empty();
        try {
            int i = indexOf(handle);
            return i >= 0 ? Optional.of(entries.get(i)) : Optional.empty();
        } finally {
            lock.unlockRead(stamp);
        }
    }

    public int size() { return size; }

    public boolean isEmpty() { return size == 0; }

    // -- Mutation -------------------------------------------------------------

    /**
     * Queues a request.
     *
     * @return true if the request is queued afterwards (including the duplicate
     *         no-op case); false if a lock could not be acquired in time
     */
    public boolean enqueue(LoadRequest request) {
        if (request == null) throw new NullPointerException("request");
        long stamp = readLock("enqueue");
        if (stamp == 0L) return false;
        try {
            if (indexOf(request.handle()) >= 0) return true;

            long writeStamp = lock.tryConvertToWriteLock(stamp);
            if (writeStamp != 0L) {
                stamp = writeStamp;
            } else {
                lock.unlockRead(stamp);
                stamp = writeLock("enqueue");
                if (stamp == 0L) return false;
                // Another writer may have queued the same handle in between.
                if (indexOf(request.handle()) >= 0) return true;
            }
            insert(request);
            return true;
        } finally {
            if (stamp != 0L) lock.unlock(stamp);
        }
    }

    /**
     * Removes and returns the most urgent request.
     * Empty if the queue is empty or the lock timed out.
     */
    public Optional<LoadRequest> dequeue() {
        long stamp = writeLock("dequeue");
        if (stamp == 0L) return Optional.empty();
        try {
            if (entries.isEmpty()) return Optional.empty();
            LoadRequest head = entries.remove(0);
            afterRemoval();
            return Optional.of(head);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    /**
     * Removes the request for {@code handle} and cancels its completion.
     *
     * @return true if a request was removed
     */
    public boolean remove(ResourceHandle handle) {
        if (handle == null) throw new NullPointerException("handle");
        LoadRequest removed;
        long stamp = writeLock("remove");
        if (stamp == 0L) return false;
        try {
            int i = indexOf(handle);
            if (i < 0) return false;
            removed = entries.remove(i);
            afterRemoval();
        } finally {
            lock.unlockWrite(stamp);
        }
        removed.cancel();
        return true;
    }

    /**
     * Removes every request and cancels their completions.
     *
     * @return number of requests removed, or -1 if the lock timed out
     */
    public int clear() {
        List<LoadRequest> removed;
        long stamp = writeLock("clear");
        if (stamp == 0L) return -1;
        try {
            removed = new ArrayList<>(entries);
            entries.clear();
            afterRemoval();
        } finally {
            lock.unlockWrite(stamp);
        }
        for (LoadRequest request : removed) {
            request.cancel();
        }
        return removed.size();
    }

    // -- Internals (lock held) ------------------------------------------------

    private void insert(LoadRequest request) {
        int p = request.priority();
        if (entries.isEmpty()) {
            entries.add(request);
            minPriority = p;
            maxPriority = p;
        } else if (p >= maxPriority) {
            entries.add(request);
            maxPriority = p;
        } else if (p < minPriority) {
            entries.add(0, request);
            minPriority = p;
        } else {
            int i = 0;
            while (i < entries.size() && entries.get(i).priority() <= p) i++;
            entries.add(i, request);
        }
        size = entries.size();
    }

    private void afterRemoval() {
        size = entries.size();
        if (!entries.isEmpty()) {
            minPriority = entries.get(0).priority();
            maxPriority = entries.get(entries.size() - 1).priority();
        }
    }

    private int indexOf(ResourceHandle handle) {
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).handle().equals(handle)) return i;
        }
        return -1;
    }

    private long readLock(String operation) {
        try {
            long stamp = lock.tryReadLock(lockTimeoutMs, TimeUnit.MILLISECONDS);
            if (stamp == 0L) reportTimeout(operation);
            return stamp;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.logException("Load queue " + operation + " interrupted", e, LogSeverity.NORMAL);
            return 0L;
        }
    }

    private long writeLock(String operation) {
        try {
            long stamp = lock.tryWriteLock(lockTimeoutMs, TimeUnit.MILLISECONDS);
            if (stamp == 0L) reportTimeout(operation);
            return stamp;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.logException("Load queue " + operation + " interrupted", e, LogSeverity.NORMAL);
            return 0L;
        }
    }

    private void reportTimeout(String operation) {
        logger.logError("Load queue " + operation + " timed out after " + lockTimeoutMs + " ms",
            LogSeverity.NORMAL);
    }
}
