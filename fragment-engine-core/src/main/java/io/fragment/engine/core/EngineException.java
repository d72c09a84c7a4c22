package io.fragment.engine.core;

/**
 * Thrown when the engine cannot be constructed or configured.
 *
 * Failures during a run are never thrown; they are logged and reported
 * through boolean results instead.
 */
public final class EngineException extends RuntimeException {

    public EngineException(String message) {
        super(message);
    }

    public EngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
