package org.edgeweave.runtime.model;

/**
 * Handle to a clock signal. Test threads block on clocks and are resumed on their rising edges.
 * A clock is never equal to a plain {@link Signal} of the same name.
 */
public final class Clock extends Signal {

    private Clock(String name) {
        super(name);
    }

    /**
     * Creates a handle for a clock signal.
     *
     * @param name The logical clock name.
     * @return The clock handle.
     */
    public static Clock of(String name) {
        return new Clock(name);
    }
}
