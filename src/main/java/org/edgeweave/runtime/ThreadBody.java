package org.edgeweave.runtime;

/**
 * Code run by a forked tester thread.
 */
@FunctionalInterface
public interface ThreadBody {

    /**
     * Runs the thread's stimulus or observation code.
     *
     * @throws Exception any failure; it terminates this thread only and is reported by
     *                   {@link ThreadedTester#run} after the run ends.
     */
    void run() throws Exception;
}
