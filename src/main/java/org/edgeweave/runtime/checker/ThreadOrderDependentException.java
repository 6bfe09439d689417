package org.edgeweave.runtime.checker;

/**
 * Two tester threads disagreed about a signal within one timestep, so the outcome would depend
 * on the order in which the scheduler resumed them.
 * <p>
 * The later issuer's call site is the cause; the earlier issuer's call site is attached as a
 * suppressed exception. Conflicts are recorded, not thrown into test code: the offending poke
 * is dropped and the run continues.
 */
public class ThreadOrderDependentException extends RuntimeException {

    /**
     * The rule that was violated.
     */
    public enum Kind {
        /** Two threads poked the same signal at the same priority. */
        POKE_PRIORITY_TIE,
        /** A thread peeked a signal that another thread later overrode in the same timestep. */
        PEEK_BEFORE_POKE
    }

    private final Kind kind;
    private final String signalName;
    private final long timestep;
    private final String firstThread;
    private final String secondThread;

    /**
     * Creates a conflict report.
     *
     * @param kind         The violated rule.
     * @param signalName   The diagnostic name of the signal.
     * @param timestep     The timestep of the conflict.
     * @param firstThread  The name of the earlier issuer.
     * @param firstSite    The earlier issuer's call site.
     * @param secondThread The name of the later issuer.
     * @param secondSite   The later issuer's call site.
     */
    public ThreadOrderDependentException(Kind kind, String signalName, long timestep,
                                         String firstThread, Throwable firstSite,
                                         String secondThread, Throwable secondSite) {
        super(describe(kind, signalName, timestep, firstThread, secondThread), secondSite);
        this.kind = kind;
        this.signalName = signalName;
        this.timestep = timestep;
        this.firstThread = firstThread;
        this.secondThread = secondThread;
        if (firstSite != null) {
            addSuppressed(firstSite);
        }
    }

    public Kind getKind() {
        return kind;
    }

    public String getSignalName() {
        return signalName;
    }

    public long getTimestep() {
        return timestep;
    }

    public String getFirstThread() {
        return firstThread;
    }

    public String getSecondThread() {
        return secondThread;
    }

    private static String describe(Kind kind, String signalName, long timestep,
                                   String firstThread, String secondThread) {
        return switch (kind) {
            case POKE_PRIORITY_TIE -> "Signal '" + signalName + "' poked at equal priority by "
                    + firstThread + " and " + secondThread + " in timestep " + timestep;
            case PEEK_BEFORE_POKE -> "Signal '" + signalName + "' peeked by " + firstThread
                    + " before " + secondThread + " poked it in timestep " + timestep;
        };
    }
}
