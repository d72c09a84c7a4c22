package io.fragment.engine.resources;

import io.fragment.engine.api.EngineLogger;
import io.fragment.engine.api.LogSeverity;
import io.fragment.engine.api.ResourceDescriptor;
import io.fragment.engine.api.ResourceHandle;

import java.util.Optional;

/**
 * Schedules and performs resource loads.
 *
 * Producers on any thread call {@link #requestLoad}. The main loop calls
 * {@link #processPending(double)} once per frame, which drains the queue in
 * priority order on the calling thread until the frame budget is spent.
 * No threads are created here.
 */
public final class ResourceLoadService {

    private final ResourceIndex index;
    private final LoadPriorityQueue queue;
    private final ResourceImporter importer;
    private final EngineLogger logger;

    private long loadedCount = 0L;
    private long failedCount = 0L;

    public ResourceLoadService(ResourceIndex index, LoadPriorityQueue queue,
                               ResourceImporter importer, EngineLogger logger) {
        if (index    == null) throw new NullPointerException("index");
        if (queue    == null) throw new NullPointerException("queue");
        if (importer == null) throw new NullPointerException("importer");
        if (logger   == null) throw new NullPointerException("logger");
        this.index    = index;
        this.queue    = queue;
        this.importer = importer;
        this.logger   = logger;
    }

    public LoadPriorityQueue queue() { return queue; }

    /** Requests a load with the default priority. */
    public Optional<LoadRequest> requestLoad(ResourceHandle handle) {
        return requestLoad(handle, ResourceConstants.DEFAULT_LOAD_PRIORITY);
    }

    /**
     * Requests a load of {@code handle}. If a request for the handle is already
     * queued, that request is returned and {@code priority} is ignored.
     *
     * @return the queued request, or empty if the queue could not be locked in time
     */
    public Optional<LoadRequest> requestLoad(ResourceHandle handle, int priority) {
        if (handle == null) throw new NullPointerException("handle");
        Optional<LoadRequest> queued = queue.peekByHandle(handle);
        if (queued.isPresent()) return queued;

        LoadRequest request = new LoadRequest(handle, priority);
        if (!queue.enqueue(request)) {
            return Optional.empty();
        }
        return Optional.of(queue.peekByHandle(handle).orElse(request));
    }

    /**
     * Drops the queued request for {@code handle}; its completion is cancelled.
     *
     * @return true if a request was dropped
     */
    public boolean abortLoading(ResourceHandle handle) {
        return queue.remove(handle);
    }

    /**
     * Loads queued resources on the calling thread until the queue is empty or
     * {@code budgetMs} has elapsed. A request that has started is always finished.
     *
     * @return number of requests processed
     */
    public int processPending(double budgetMs) {
        long budgetNs = (long) (budgetMs * 1_000_000);
        long start = System.nanoTime();
        int processed = 0;
        for (;;) {
            if (System.nanoTime() - start >= budgetNs) break;
            Optional<LoadRequest> next = queue.dequeue();
            if (next.isEmpty()) break;
            process(next.get());
            processed++;
        }
        return processed;
    }

    /** Total requests completed with a loaded resource. Main-loop thread only. */
    public long loadedCount() { return loadedCount; }

    /** Total requests completed as failed. Main-loop thread only. */
    public long failedCount() { return failedCount; }

    private void process(LoadRequest request) {
        if (request.isDone()) return;
        ResourceHandle handle = request.handle();
        Optional<ResourceDescriptor> descriptor = index.lookup(handle.resourceKey());
        if (descriptor.isEmpty()) {
            logger.logError("Cannot load " + handle + ": no such resource", LogSeverity.NORMAL);
            finish(request, false);
            return;
        }
        boolean loaded;
        try {
            loaded = importer.importResource(descriptor.get());
        } catch (Exception e) {
            logger.logException("Failed to load " + handle, e, LogSeverity.HIGH);
            loaded = false;
        }
        if (!loaded) {
            logger.logWarning("Resource " + handle + " did not load", LogSeverity.NORMAL);
        }
        finish(request, loaded);
    }

    private void finish(LoadRequest request, boolean loaded) {
        if (request.complete(loaded)) {
            if (loaded) loadedCount++; else failedCount++;
        }
    }
}
