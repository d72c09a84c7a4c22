package io.fragment.engine.core;

/**
 * Refreshes input device snapshots, called once per main-loop frame after the
 * time service has started the frame.
 */
@FunctionalInterface
public interface InputService {

    /** @return false if the frame should be reported as failed */
    boolean update();

    /** Input service with no devices. */
    static InputService none() {
        return () -> true;
    }
}
