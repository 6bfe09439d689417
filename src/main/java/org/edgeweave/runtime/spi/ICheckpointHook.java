package org.edgeweave.runtime.spi;

/**
 * Out-of-band hook invoked exactly once per committed timestep, right before the simulator is
 * stepped. Typical uses are waveform or state snapshots.
 * <p>
 * The hook is fire-and-forget: a failing hook is logged and does not stop the run.
 * </p>
 */
@FunctionalInterface
public interface ICheckpointHook {

    /** A hook that does nothing. */
    ICheckpointHook NONE = timestep -> { };

    /**
     * Called once per committed timestep.
     *
     * @param timestep The zero-based index of the timestep being committed.
     */
    void checkpoint(long timestep);
}
