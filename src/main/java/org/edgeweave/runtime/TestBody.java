package org.edgeweave.runtime;

/**
 * The body of a test, run as the main tester thread. The run ends when it returns.
 *
 * @param <T> The type of the device-under-test handle.
 */
@FunctionalInterface
public interface TestBody<T> {

    /**
     * Runs the test.
     *
     * @param dut The device-under-test handle given to the tester.
     * @throws Exception any failure; it is reported by {@link ThreadedTester#run}.
     */
    void run(T dut) throws Exception;
}
