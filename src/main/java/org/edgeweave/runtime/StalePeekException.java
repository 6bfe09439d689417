package org.edgeweave.runtime;

/**
 * Thrown when test code requests a stale peek, i.e. the value a signal had before the most
 * recent poke in the same timestep. Stale peeks have no defined semantics yet and always fail.
 */
public class StalePeekException extends UnsupportedOperationException {

    /**
     * Creates a StalePeekException for the given signal.
     *
     * @param signalName The diagnostic name of the peeked signal
     */
    public StalePeekException(String signalName) {
        super("Stale peek of '" + signalName + "' is not supported");
    }
}
