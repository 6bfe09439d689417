package org.edgeweave.runtime;

import java.util.Objects;

import org.edgeweave.runtime.spi.ICheckpointHook;
import org.edgeweave.runtime.spi.IResultCollector;

/**
 * The environment of one run: where recoverable outcomes are reported and which hook is called
 * per committed timestep. Passed explicitly to {@link ThreadedTester#run(TesterContext, TestBody)}.
 */
public final class TesterContext {

    private final IResultCollector resultCollector;
    private final ICheckpointHook checkpointHook;

    /**
     * Creates a context.
     *
     * @param resultCollector Receives expectation outcomes and conflicts.
     * @param checkpointHook  Called once per committed timestep.
     */
    public TesterContext(IResultCollector resultCollector, ICheckpointHook checkpointHook) {
        this.resultCollector = Objects.requireNonNull(resultCollector, "resultCollector");
        this.checkpointHook = Objects.requireNonNull(checkpointHook, "checkpointHook");
    }

    /**
     * Creates a context without checkpointing.
     *
     * @param resultCollector Receives expectation outcomes and conflicts.
     * @return The context.
     */
    public static TesterContext of(IResultCollector resultCollector) {
        return new TesterContext(resultCollector, ICheckpointHook.NONE);
    }

    public IResultCollector getResultCollector() {
        return resultCollector;
    }

    public ICheckpointHook getCheckpointHook() {
        return checkpointHook;
    }
}
