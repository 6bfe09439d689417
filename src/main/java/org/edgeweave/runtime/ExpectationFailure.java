package org.edgeweave.runtime;

import java.math.BigInteger;

/**
 * A failed {@code expect}: the observed value of a signal differed from the expected one.
 * <p>
 * Expectation failures are recoverable. They are handed to the run's
 * {@link org.edgeweave.runtime.spi.IResultCollector} and the run continues.
 *
 * @param signalName The diagnostic name of the checked signal.
 * @param expected   The expected value.
 * @param actual     The observed value.
 * @param timestep   The timestep in which the check happened.
 * @param threadName The name of the tester thread that issued the check.
 * @param message    An optional user message, may be {@code null}.
 */
public record ExpectationFailure(
        String signalName,
        BigInteger expected,
        BigInteger actual,
        long timestep,
        String threadName,
        String message) {

    /**
     * Returns a one-line description of the mismatch.
     *
     * @return The description.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder()
                .append("Expected ").append(signalName)
                .append(" == ").append(expected)
                .append(" but was ").append(actual)
                .append(" (timestep ").append(timestep)
                .append(", thread ").append(threadName).append(')');
        if (message != null && !message.isEmpty()) {
            sb.append(": ").append(message);
        }
        return sb.toString();
    }
}
