package org.edgeweave.runtime.checker;

/**
 * Outcome of arbitrating a poke against the other pokes of the same signal in the same timestep
 * window. Lower numeric priority wins.
 */
public enum PokeResolution {
    /** The poke dominates and is forwarded to the simulator. */
    APPLIED,
    /** An earlier poke with a lower numeric priority dominates; the poke is dropped. */
    LOST_LOWER_PRIORITY_WON,
    /** Another thread poked at the same priority; the poke is dropped and a conflict reported. */
    LOST_PRIORITY_CONFLICT
}
