package org.edgeweave.runtime.checker;

import org.edgeweave.runtime.TesterThread;
import org.edgeweave.runtime.model.Clock;
import org.edgeweave.runtime.model.Signal;

/**
 * A peek logged for the current timestep.
 *
 * @param signal   The observed signal.
 * @param issuer   The tester thread that peeked.
 * @param window   The clock window the issuer ran in.
 * @param sequence Position of the peek among all pokes and peeks of the timestep.
 * @param callSite Stack trace of the issuing call, for diagnostics.
 */
public record PeekRecord(
        Signal signal,
        TesterThread issuer,
        Clock window,
        long sequence,
        Throwable callSite) {
}
