package org.edgeweave.runtime.spi;

import java.math.BigInteger;

/**
 * Contract of the cycle-accurate circuit evaluator driven by the tester.
 * <p>
 * The simulator has no notion of concurrency. The tester guarantees that it is only called by
 * one thread at a time and that {@link #step(int)} is only called by the scheduler, never from
 * test code.
 * </p>
 * <p>
 * Any engine satisfying this contract is pluggable; see
 * {@link org.edgeweave.runtime.sim.InMemorySimulator} for a small reference implementation.
 * </p>
 */
public interface ISimulator {

    /**
     * Drives an input port.
     *
     * @param port  The simulator port identifier.
     * @param value The value to drive.
     */
    void poke(String port, BigInteger value);

    /**
     * Reads the current value of a port.
     *
     * @param port The simulator port identifier.
     * @return The current value.
     */
    BigInteger peek(String port);

    /**
     * Advances physical simulation time by whole cycles of the main clock.
     *
     * @param cycles The number of cycles to advance.
     */
    void step(int cycles);
}
