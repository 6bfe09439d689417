package org.edgeweave.runtime.checker;

import java.math.BigInteger;

import org.edgeweave.runtime.TesterThread;
import org.edgeweave.runtime.model.Clock;
import org.edgeweave.runtime.model.Signal;

/**
 * A poke attempt logged for the current timestep.
 *
 * @param signal     The poked signal.
 * @param value      The value the issuer tried to drive.
 * @param priority   The poke priority; lower numbers win.
 * @param issuer     The tester thread that poked.
 * @param window     The clock window the issuer ran in.
 * @param sequence   Position of the attempt among all pokes and peeks of the timestep.
 * @param callSite   Stack trace of the issuing call, for diagnostics.
 * @param resolution How the attempt was arbitrated.
 */
public record PokeRecord(
        Signal signal,
        BigInteger value,
        int priority,
        TesterThread issuer,
        Clock window,
        long sequence,
        Throwable callSite,
        PokeResolution resolution) {
}
