package org.edgeweave.runtime;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown by {@link ThreadedTester#run} after teardown when one or more tester threads
 * terminated with an exception.
 * <p>
 * The first failure (in completion order) is the cause; every further failure is attached as a
 * suppressed exception.
 */
public class TesterThreadException extends RuntimeException {

    private final List<String> failedThreads;

    /**
     * Aggregates the failures of the given threads.
     *
     * @param threads The failed threads in completion order, not empty.
     * @throws IllegalArgumentException if no thread is given
     */
    public TesterThreadException(List<TesterThread> threads) {
        super(describe(threads), threads.isEmpty() ? null : threads.get(0).getFailure());
        this.failedThreads = threads.stream().map(TesterThread::getName).collect(Collectors.toList());
        for (int i = 1; i < threads.size(); i++) {
            addSuppressed(threads.get(i).getFailure());
        }
    }

    /**
     * Returns the names of the failed threads in completion order.
     *
     * @return An unmodifiable list of thread names.
     */
    public List<String> getFailedThreads() {
        return Collections.unmodifiableList(failedThreads);
    }

    private static String describe(List<TesterThread> threads) {
        if (threads.isEmpty()) {
            throw new IllegalArgumentException("At least one failed thread is required");
        }
        String details = threads.stream()
                .map(t -> t.getName() + " (" + t.getFailure() + ")")
                .collect(Collectors.joining(", "));
        return threads.size() + " tester thread(s) failed: " + details;
    }
}
