package io.fragment.engine.resources;

import io.fragment.engine.api.ResourceHandle;

import java.util.concurrent.CompletableFuture;

/**
 * A pending request to load one resource.
 *
 * The completion future is single-assignment: the first of
 * {@link #complete(boolean)} or {@link #cancel()} wins, later calls are ignored.
 * Callers observe it through {@link #completion()}, which cannot be used to
 * complete the request.
 */
public final class LoadRequest {

    private final ResourceHandle handle;
    private final int priority;
    private final CompletableFuture<Boolean> completion = new CompletableFuture<>();

    /** Request with {@link ResourceConstants#DEFAULT_LOAD_PRIORITY}. */
    public LoadRequest(ResourceHandle handle) {
        this(handle, ResourceConstants.DEFAULT_LOAD_PRIORITY);
    }

    /**
     * @param handle   resource to load; must not be null
     * @param priority lower values are served first
     */
    public LoadRequest(ResourceHandle handle, int priority) {
        if (handle == null) throw new NullPointerException("handle");
        this.handle = handle;
        this.priority = priority;
    }

    public ResourceHandle handle() { return handle; }

    public int priority() { return priority; }

    /**
     * Read-only view of the completion. Resolves to true once the resource has
     * loaded and false if loading failed. If the request was aborted the view
     * completes exceptionally with a CancellationException as cause.
     */
    public CompletableFuture<Boolean> completion() {
        return completion.copy();
    }

    /** @return true if this call resolved the request */
    public boolean complete(boolean loaded) {
        return completion.complete(loaded);
    }

    /** @return true if this call cancelled the request */
    public boolean cancel() {
        return completion.cancel(false);
    }

    public boolean isDone() { return completion.isDone(); }

    /** True if the request was aborted before it was processed. */
    public boolean isCancelled() { return completion.isCancelled(); }

    @Override
    public String toString() {
        return "LoadRequest[" + handle + ", priority=" + priority + "]";
    }
}
