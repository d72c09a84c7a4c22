package io.fragment.engine.core;

/**
 * Window and OS message pump, called once at the start of every main-loop frame.
 */
public interface WindowService {

    /**
     * Pumps pending window events.
     *
     * @return false if the frame should be reported as failed
     */
    boolean update();

    /** Window service for headless and test environments. Counts frames only. */
    static HeadlessWindowService headless() {
        return new HeadlessWindowService();
    }
}
