package io.fragment.engine.core;

/**
 * Monotonic cancellation flag shared between a main loop and the code that
 * wants it to stop. Once cancelled it never resets; a new run or a new state
 * initialization allocates a fresh signal.
 */
public final class CancellationSignal {

    private static final CancellationSignal NEVER = new CancellationSignal(false);

    private final boolean cancellable;
    private volatile boolean cancelled = false;

    public CancellationSignal() {
        this(true);
    }

    private CancellationSignal(boolean cancellable) {
        this.cancellable = cancellable;
    }

    /** A shared signal that ignores cancel() and is never raised. */
    public static CancellationSignal never() { return NEVER; }

    /** Raises the signal. Idempotent. */
    public void cancel() {
        if (cancellable) cancelled = true;
    }

    public boolean isCancelled() { return cancelled; }
}
