package org.edgeweave.runtime.checker;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.edgeweave.runtime.TesterThread;
import org.edgeweave.runtime.model.Clock;
import org.edgeweave.runtime.model.PortNameMap;
import org.edgeweave.runtime.model.Signal;
import org.edgeweave.runtime.spi.IResultCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates the pokes and peeks that tester threads issue within one timestep.
 * <p>
 * Every thread resumed in a timestep runs inside the <i>window</i> of the clock that resumed it.
 * Threads in different windows are not concurrent with respect to each other, so records are
 * only compared within a window. Forked threads and released joiners inherit the window of the
 * thread that made them runnable.
 * <p>
 * Records are grouped by simulator port, so a {@link Signal} and a {@link Clock} handle, or two
 * signals mapped to the same port, are checked against each other.
 * <p>
 * Rules, per port and window:
 * <ul>
 *   <li>The poke with the lowest numeric priority dominates. A poke that does not dominate is
 *       dropped ({@link PokeResolution#LOST_LOWER_PRIORITY_WON}).</li>
 *   <li>Two different threads poking at the same priority is a
 *       {@link ThreadOrderDependentException.Kind#POKE_PRIORITY_TIE}; the second poke is dropped.</li>
 *   <li>A peek followed by an applied poke from another thread is a
 *       {@link ThreadOrderDependentException.Kind#PEEK_BEFORE_POKE}, detected when the timestep
 *       is finished.</li>
 * </ul>
 * Conflicts are handed to the {@link IResultCollector}; nothing is thrown into test code.
 * <p>
 * <b>Thread safety:</b> not thread-safe. Called by the running tester thread and by the
 * scheduler, which never run at the same time.
 */
public class ThreadingChecker {

    private static final Logger LOG = LoggerFactory.getLogger(ThreadingChecker.class);

    private final Clock mainClock;
    private final PortNameMap ports;
    private final IResultCollector collector;

    // Keyed by simulator port, so handles aliasing one port are arbitrated together
    private final Map<String, List<PokeRecord>> portPokes = new LinkedHashMap<>();
    private final Map<String, List<PeekRecord>> portPeeks = new LinkedHashMap<>();
    private final Map<TesterThread, Clock> threadWindows = new HashMap<>();
    private final Set<Clock> openWindows = new LinkedHashSet<>();
    private long sequence = 0L;
    private long timestep = 0L;

    /**
     * Creates a checker whose first timestep has the main clock window open.
     *
     * @param mainClock The main clock.
     * @param ports     Port map used to group records by port and for diagnostic names.
     * @param collector Receives conflicts.
     */
    public ThreadingChecker(Clock mainClock, PortNameMap ports, IResultCollector collector) {
        this.mainClock = mainClock;
        this.ports = ports;
        this.collector = collector;
        openWindows.add(mainClock);
    }

    public long getTimestep() {
        return timestep;
    }

    /**
     * Opens a fresh validation window for threads resumed by a dependent clock that fired in the
     * current timestep.
     *
     * @param clock The clock that fired.
     */
    public void newTimestep(Clock clock) {
        if (openWindows.add(clock)) {
            LOG.debug("Timestep {}: opened window for clock '{}'", timestep, ports.displayName(clock));
        }
    }

    /**
     * Places a thread into a window for the rest of its run in this timestep.
     *
     * @param thread The thread about to run.
     * @param window The clock whose window it runs in.
     * @throws IllegalStateException if the window was not opened in this timestep
     */
    public void enterWindow(TesterThread thread, Clock window) {
        if (!openWindows.contains(window)) {
            throw new IllegalStateException("Window for clock '" + ports.displayName(window)
                    + "' is not open in timestep " + timestep);
        }
        threadWindows.put(thread, window);
    }

    /**
     * Returns the window of a thread, defaulting to the main clock window.
     *
     * @param thread The thread.
     * @return Its window.
     */
    public Clock windowOf(TesterThread thread) {
        return threadWindows.getOrDefault(thread, mainClock);
    }

    /**
     * Records a poke attempt and decides whether it reaches the simulator.
     *
     * @param signal   The poked signal.
     * @param value    The value to drive.
     * @param priority The poke priority; lower numbers win.
     * @param issuer   The poking thread.
     * @param callSite Stack trace of the poke, for conflict diagnostics.
     * @return {@code true} if the poke dominates and must be forwarded to the simulator.
     */
    public boolean doPoke(Signal signal, BigInteger value, int priority, TesterThread issuer, Throwable callSite) {
        Clock window = windowOf(issuer);
        List<PokeRecord> records = portPokes.computeIfAbsent(ports.displayName(signal), k -> new ArrayList<>());

        // Applied pokes never increase in priority, so the last applied one dominates
        PokeRecord dominant = null;
        for (PokeRecord record : records) {
            if (record.window().equals(window) && record.resolution() == PokeResolution.APPLIED) {
                dominant = record;
            }
        }

        PokeResolution resolution;
        if (dominant == null || priority < dominant.priority()) {
            resolution = PokeResolution.APPLIED;
        } else if (priority > dominant.priority()) {
            resolution = PokeResolution.LOST_LOWER_PRIORITY_WON;
        } else if (dominant.issuer() == issuer) {
            resolution = PokeResolution.APPLIED;
        } else {
            resolution = PokeResolution.LOST_PRIORITY_CONFLICT;
        }

        records.add(new PokeRecord(signal, value, priority, issuer, window, sequence++, callSite, resolution));

        if (resolution == PokeResolution.LOST_PRIORITY_CONFLICT) {
            report(new ThreadOrderDependentException(
                    ThreadOrderDependentException.Kind.POKE_PRIORITY_TIE,
                    ports.displayName(signal), timestep,
                    dominant.issuer().getName(), dominant.callSite(),
                    issuer.getName(), callSite));
        } else if (resolution == PokeResolution.LOST_LOWER_PRIORITY_WON) {
            LOG.debug("Timestep {}: poke of '{}' by {} at priority {} dropped, priority {} dominates",
                    timestep, ports.displayName(signal), issuer, priority, dominant.priority());
        }
        return resolution == PokeResolution.APPLIED;
    }

    /**
     * Records that a thread observed a signal.
     *
     * @param signal   The peeked signal.
     * @param issuer   The peeking thread.
     * @param callSite Stack trace of the peek, for conflict diagnostics.
     */
    public void doPeek(Signal signal, TesterThread issuer, Throwable callSite) {
        portPeeks.computeIfAbsent(ports.displayName(signal), k -> new ArrayList<>())
                .add(new PeekRecord(signal, issuer, windowOf(issuer), sequence++, callSite));
    }

    /**
     * Closes a thread's window membership when it blocks or finishes.
     *
     * @param thread The thread.
     * @param clock  The clock it now waits on, or {@code null} if it finished or joins.
     */
    public void finishThread(TesterThread thread, Clock clock) {
        Clock window = threadWindows.remove(thread);
        if (LOG.isTraceEnabled()) {
            LOG.trace("Timestep {}: {} left window '{}'{}", timestep, thread,
                    window == null ? ports.displayName(mainClock) : ports.displayName(window),
                    clock == null ? "" : ", waiting on '" + ports.displayName(clock) + "'");
        }
    }

    /**
     * Validates peek ordering, reports violations, and clears the log for the next timestep.
     *
     * @return The peek-ordering violations found in this timestep.
     */
    public List<ThreadOrderDependentException> finishTimestep() {
        List<ThreadOrderDependentException> violations = new ArrayList<>();
        for (Map.Entry<String, List<PeekRecord>> entry : portPeeks.entrySet()) {
            List<PokeRecord> pokes = portPokes.get(entry.getKey());
            if (pokes == null) {
                continue;
            }
            for (PeekRecord peek : entry.getValue()) {
                PokeRecord overriding = findLaterForeignPoke(peek, pokes);
                if (overriding != null) {
                    ThreadOrderDependentException violation = new ThreadOrderDependentException(
                            ThreadOrderDependentException.Kind.PEEK_BEFORE_POKE,
                            ports.displayName(peek.signal()), timestep,
                            peek.issuer().getName(), peek.callSite(),
                            overriding.issuer().getName(), overriding.callSite());
                    violations.add(violation);
                    report(violation);
                }
            }
        }

        portPokes.clear();
        portPeeks.clear();
        threadWindows.clear();
        openWindows.clear();
        openWindows.add(mainClock);
        sequence = 0L;
        timestep++;
        return Collections.unmodifiableList(violations);
    }

    private static PokeRecord findLaterForeignPoke(PeekRecord peek, List<PokeRecord> pokes) {
        for (PokeRecord poke : pokes) {
            if (poke.resolution() == PokeResolution.APPLIED
                    && poke.window().equals(peek.window())
                    && poke.sequence() > peek.sequence()
                    && poke.issuer() != peek.issuer()) {
                return poke;
            }
        }
        return null;
    }

    /**
     * Returns the pokes logged so far for the port of a signal in the current timestep.
     *
     * @param signal The signal.
     * @return An unmodifiable list of poke records.
     */
    public List<PokeRecord> pokesOf(Signal signal) {
        return Collections.unmodifiableList(portPokes.getOrDefault(ports.displayName(signal), List.of()));
    }

    /**
     * Returns the peeks logged so far for the port of a signal in the current timestep.
     *
     * @param signal The signal.
     * @return An unmodifiable list of peek records.
     */
    public List<PeekRecord> peeksOf(Signal signal) {
        return Collections.unmodifiableList(portPeeks.getOrDefault(ports.displayName(signal), List.of()));
    }

    private void report(ThreadOrderDependentException conflict) {
        LOG.warn("{}", conflict.getMessage());
        collector.recordConflict(conflict);
    }
}
