package org.edgeweave.runtime;

/**
 * Unwinds a tester thread that is cancelled during teardown. Raised at the thread's next
 * suspension point ({@code step}, {@code join}, {@code poke}, {@code peek}, {@code expect},
 * {@code fork}).
 * <p>
 * Cancellation is not a failure: it is never reported to the caller of
 * {@link ThreadedTester#run}. Test code should not catch it.
 */
public class ThreadCancelledException extends RuntimeException {

    /**
     * Creates a ThreadCancelledException.
     *
     * @param threadName The name of the cancelled tester thread
     */
    public ThreadCancelledException(String threadName) {
        super("Tester thread '" + threadName + "' was cancelled");
    }
}
