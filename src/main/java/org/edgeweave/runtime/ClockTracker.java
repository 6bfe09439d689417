package org.edgeweave.runtime;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.edgeweave.runtime.model.Clock;
import org.edgeweave.runtime.model.PortNameMap;
import org.edgeweave.runtime.spi.ISimulator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Observes dependent clocks once per timestep and reports their rising edges.
 * <p>
 * The main clock is stepped by the scheduler itself and rises exactly once per timestep by
 * construction, so it is never sampled. A dependent clock is tracked from the moment a thread
 * first blocks on it until no thread waits on it any more; tracked state is therefore bounded by
 * the clocks test code actually waits on, not by the clocks of the circuit.
 * <p>
 * Edge counters are kept for every clock that ever fired and survive untracking.
 */
public class ClockTracker {

    private static final Logger LOG = LoggerFactory.getLogger(ClockTracker.class);

    private final ISimulator simulator;
    private final PortNameMap ports;
    private final Clock mainClock;
    private final Map<Clock, Boolean> lastClockValue = new LinkedHashMap<>();
    private final Map<Clock, Long> clockCounter = new HashMap<>();

    public ClockTracker(ISimulator simulator, PortNameMap ports, Clock mainClock) {
        this.simulator = simulator;
        this.ports = ports;
        this.mainClock = mainClock;
    }

    public Clock getMainClock() {
        return mainClock;
    }

    /**
     * Reads the current level of a clock from the simulator.
     *
     * @param clock The clock.
     * @return {@code true} if the clock is high.
     * @throws IllegalStateException if the port holds a value other than 0 or 1
     */
    public boolean observe(Clock clock) {
        BigInteger value = simulator.peek(ports.portFor(clock));
        if (BigInteger.ZERO.equals(value)) {
            return false;
        }
        if (BigInteger.ONE.equals(value)) {
            return true;
        }
        throw new IllegalStateException("Clock '" + ports.displayName(clock) + "' has non-boolean value " + value);
    }

    /**
     * Starts tracking a dependent clock, using its current level as baseline. Does nothing for
     * the main clock or an already tracked clock.
     *
     * @param clock The clock a thread is about to block on.
     */
    public void track(Clock clock) {
        if (clock.equals(mainClock) || lastClockValue.containsKey(clock)) {
            return;
        }
        boolean level = observe(clock);
        lastClockValue.put(clock, level);
        LOG.debug("Tracking clock '{}' (baseline {})", ports.displayName(clock), level ? 1 : 0);
    }

    public boolean isTracked(Clock clock) {
        return lastClockValue.containsKey(clock);
    }

    /**
     * Samples a tracked clock and reports whether it went from low to high since the last sample.
     * The recorded level is always updated.
     *
     * @param clock A tracked dependent clock.
     * @return {@code true} on a rising edge.
     * @throws IllegalStateException if the clock is not tracked
     */
    public boolean rose(Clock clock) {
        Boolean last = lastClockValue.get(clock);
        if (last == null) {
            throw new IllegalStateException("Clock '" + ports.displayName(clock) + "' is not tracked");
        }
        boolean current = observe(clock);
        lastClockValue.put(clock, current);
        return !last && current;
    }

    /**
     * Drops the tracked state of every dependent clock outside the given set.
     *
     * @param waitedClocks The clocks that still have waiting threads.
     */
    public void retainOnly(Set<Clock> waitedClocks) {
        lastClockValue.keySet().removeIf(clock -> {
            boolean drop = !waitedClocks.contains(clock);
            if (drop) {
                LOG.debug("Untracking clock '{}'", ports.displayName(clock));
            }
            return drop;
        });
    }

    /**
     * Returns the tracked dependent clocks in tracking order.
     *
     * @return A snapshot of the tracked clocks.
     */
    public List<Clock> trackedClocks() {
        return new ArrayList<>(lastClockValue.keySet());
    }

    /**
     * Counts a rising edge the scheduler acted upon.
     *
     * @param clock The clock that fired.
     */
    public void recordEdge(Clock clock) {
        clockCounter.merge(clock, 1L, Long::sum);
    }

    /**
     * Returns the number of rising edges of a clock the scheduler has acted upon.
     *
     * @param clock The clock.
     * @return The edge count, 0 for a clock that never fired.
     */
    public long getClockCycle(Clock clock) {
        return clockCounter.getOrDefault(clock, 0L);
    }
}
