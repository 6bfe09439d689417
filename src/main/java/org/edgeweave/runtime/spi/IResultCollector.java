package org.edgeweave.runtime.spi;

import org.edgeweave.runtime.ExpectationFailure;
import org.edgeweave.runtime.checker.ThreadOrderDependentException;

/**
 * Receives the recoverable outcomes of a run: checked expectations and threading conflicts.
 * <p>
 * Recorded items never stop the run. Implementations are called from the tester thread that
 * issued the operation, or from the scheduler thread when a timestep is committed; never from
 * two threads at once.
 * </p>
 *
 * @see org.edgeweave.runtime.TestResults
 */
public interface IResultCollector {

    /**
     * Called when an expectation matched.
     *
     * @param signalName The diagnostic name of the checked signal.
     */
    void recordExpectationPassed(String signalName);

    /**
     * Called when an expectation observed a value different from the expected one.
     *
     * @param failure The mismatch.
     */
    void recordExpectationFailure(ExpectationFailure failure);

    /**
     * Called when two threads disagreed about a signal within one timestep.
     *
     * @param conflict The conflict, carrying both issuers' call sites.
     */
    void recordConflict(ThreadOrderDependentException conflict);
}
