package org.edgeweave.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.edgeweave.runtime.checker.ThreadOrderDependentException;
import org.edgeweave.runtime.spi.IResultCollector;

/**
 * In-memory {@link IResultCollector} that keeps every outcome of a run for later inspection.
 */
public class TestResults implements IResultCollector {

    private final List<ExpectationFailure> expectationFailures = new ArrayList<>();
    private final List<ThreadOrderDependentException> conflicts = new ArrayList<>();
    private long expectationsChecked = 0L;

    @Override
    public void recordExpectationPassed(String signalName) {
        expectationsChecked++;
    }

    @Override
    public void recordExpectationFailure(ExpectationFailure failure) {
        expectationsChecked++;
        expectationFailures.add(failure);
    }

    @Override
    public void recordConflict(ThreadOrderDependentException conflict) {
        conflicts.add(conflict);
    }

    public long getExpectationsChecked() {
        return expectationsChecked;
    }

    public List<ExpectationFailure> getExpectationFailures() {
        return Collections.unmodifiableList(expectationFailures);
    }

    public List<ThreadOrderDependentException> getConflicts() {
        return Collections.unmodifiableList(conflicts);
    }

    /**
     * Returns whether the run recorded neither expectation failures nor conflicts.
     *
     * @return {@code true} if the run passed.
     */
    public boolean isPassed() {
        return expectationFailures.isEmpty() && conflicts.isEmpty();
    }

    @Override
    public String toString() {
        return "TestResults{checked=" + expectationsChecked
                + ", failures=" + expectationFailures.size()
                + ", conflicts=" + conflicts.size() + "}";
    }
}
