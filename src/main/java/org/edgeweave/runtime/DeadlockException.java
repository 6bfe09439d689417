package org.edgeweave.runtime;

/**
 * Thrown by {@link ThreadedTester#run} when the main thread is not finished but no tester
 * thread can ever be resumed again.
 * <p>
 * Possible causes include:
 * <ul>
 *   <li>Threads joining each other in a cycle</li>
 *   <li>The main thread joining a thread that is itself waiting on the main thread</li>
 *   <li>Threads waiting on a dependent clock that stays constant, once the idle timestep limit is reached</li>
 * </ul>
 */
public class DeadlockException extends RuntimeException {

    /**
     * Creates a DeadlockException with the specified message.
     *
     * @param message Description of the stall
     */
    public DeadlockException(String message) {
        super(message);
    }
}
