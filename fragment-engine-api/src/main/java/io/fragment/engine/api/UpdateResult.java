package io.fragment.engine.api;

/**
 * Outcome of one frame of application loading or unloading logic.
 *
 * @param success false if the frame failed; the engine logs it and keeps looping
 * @param done    true once the application has finished this phase
 */
public record UpdateResult(boolean success, boolean done) {

    private static final UpdateResult IN_PROGRESS = new UpdateResult(true, false);
    private static final UpdateResult COMPLETED = new UpdateResult(true, true);
    private static final UpdateResult FAILED = new UpdateResult(false, true);

    /** Frame succeeded, more frames needed. */
    public static UpdateResult inProgress() { return IN_PROGRESS; }

    /** Frame succeeded and the phase is complete. */
    public static UpdateResult completed() { return COMPLETED; }

    /** Frame failed; the phase is abandoned. */
    public static UpdateResult failed() { return FAILED; }
}
