package org.edgeweave.runtime;

/**
 * States of the run loop of {@link ThreadedTester}.
 */
public enum SchedulerState {
    /** Between timesteps, or before the run started. */
    IDLE,
    /** Determining which clocks fired and which threads they release. */
    RESOLVING_EDGES,
    /** Resuming released threads one at a time. */
    RUNNING_THREADS,
    /** Validating the timestep and stepping the simulator. */
    COMMITTING,
    /** The main thread finished; remaining threads are cancelled. */
    FINISHED
}
