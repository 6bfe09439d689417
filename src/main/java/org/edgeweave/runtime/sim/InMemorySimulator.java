package org.edgeweave.runtime.sim;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

import org.edgeweave.runtime.spi.ISimulator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A small deterministic {@link ISimulator} for tests and embedding.
 * <p>
 * Supported port kinds:
 * <ul>
 *   <li><b>Inputs</b>: hold the last poked value</li>
 *   <li><b>Clocks</b>: derived from the main cycle count with an even period; high during the
 *       second half of each period, so a period-2 clock rises on every odd cycle</li>
 *   <li><b>Combinational outputs</b>: computed from other ports on every peek</li>
 *   <li><b>Registers</b>: updated from a next-state function once per cycle; all registers
 *       sample their next state before any of them changes</li>
 * </ul>
 * Reset is not special: declare the reset port as an input and let registers read it.
 * <p>
 * <b>Thread safety:</b> not thread-safe. The tester calls it from one thread at a time.
 */
public class InMemorySimulator implements ISimulator {

    private static final Logger LOG = LoggerFactory.getLogger(InMemorySimulator.class);

    private final Map<String, BigInteger> inputs = new LinkedHashMap<>();
    private final Map<String, Integer> clockPeriods = new LinkedHashMap<>();
    private final Map<String, Function<InMemorySimulator, BigInteger>> outputs = new LinkedHashMap<>();
    private final Map<String, BigInteger> registers = new LinkedHashMap<>();
    private final Map<String, Function<InMemorySimulator, BigInteger>> nextState = new LinkedHashMap<>();
    private long cycle = 0L;

    public InMemorySimulator addInput(String port, long initial) {
        return addInput(port, BigInteger.valueOf(initial));
    }

    /**
     * Declares an input port.
     *
     * @param port    The port name.
     * @param initial The value before the first poke.
     * @return This simulator, for chaining.
     */
    public InMemorySimulator addInput(String port, BigInteger initial) {
        declare(port);
        inputs.put(port, initial);
        return this;
    }

    /**
     * Declares a clock port toggling every {@code period / 2} main cycles.
     *
     * @param port   The port name.
     * @param period The clock period in main cycles, even and at least 2.
     * @return This simulator, for chaining.
     * @throws IllegalArgumentException if the period is odd or less than 2
     */
    public InMemorySimulator addClock(String port, int period) {
        if (period < 2 || period % 2 != 0) {
            throw new IllegalArgumentException("Clock period must be even and >= 2, got " + period);
        }
        declare(port);
        clockPeriods.put(port, period);
        return this;
    }

    /**
     * Declares a combinational output.
     *
     * @param port     The port name.
     * @param function Computes the value from the current state of other ports.
     * @return This simulator, for chaining.
     */
    public InMemorySimulator addOutput(String port, Function<InMemorySimulator, BigInteger> function) {
        declare(port);
        outputs.put(port, function);
        return this;
    }

    /**
     * Declares a register.
     *
     * @param port    The port name.
     * @param initial The value before the first cycle.
     * @param next    Computes the value after the next cycle from the current state.
     * @return This simulator, for chaining.
     */
    public InMemorySimulator addRegister(String port, BigInteger initial, Function<InMemorySimulator, BigInteger> next) {
        declare(port);
        registers.put(port, initial);
        nextState.put(port, next);
        return this;
    }

    private void declare(String port) {
        if (inputs.containsKey(port) || clockPeriods.containsKey(port)
                || outputs.containsKey(port) || registers.containsKey(port)) {
            throw new IllegalArgumentException("Port '" + port + "' is already declared");
        }
    }

    @Override
    public void poke(String port, BigInteger value) {
        if (!inputs.containsKey(port)) {
            throw new IllegalArgumentException("Port '" + port + "' is not an input");
        }
        inputs.put(port, value);
    }

    @Override
    public BigInteger peek(String port) {
        BigInteger value = inputs.get(port);
        if (value != null) {
            return value;
        }
        value = registers.get(port);
        if (value != null) {
            return value;
        }
        Integer period = clockPeriods.get(port);
        if (period != null) {
            return BigInteger.valueOf((cycle / (period / 2)) % 2);
        }
        Function<InMemorySimulator, BigInteger> output = outputs.get(port);
        if (output != null) {
            return output.apply(this);
        }
        throw new IllegalArgumentException("Unknown port '" + port + "'");
    }

    /**
     * Reads a port as a {@code long}, for use inside next-state and output functions.
     *
     * @param port The port name.
     * @return The current value.
     */
    public long peekLong(String port) {
        return peek(port).longValueExact();
    }

    @Override
    public void step(int cycles) {
        if (cycles < 0) {
            throw new IllegalArgumentException("cycles must be >= 0, got " + cycles);
        }
        for (int i = 0; i < cycles; i++) {
            Map<String, BigInteger> next = new LinkedHashMap<>();
            for (Map.Entry<String, Function<InMemorySimulator, BigInteger>> entry : nextState.entrySet()) {
                next.put(entry.getKey(), entry.getValue().apply(this));
            }
            registers.putAll(next);
            cycle++;
        }
        LOG.trace("Stepped {} cycle(s), now at cycle {}", cycles, cycle);
    }

    /**
     * Returns the number of main cycles simulated so far.
     *
     * @return The cycle count.
     */
    public long getCycle() {
        return cycle;
    }
}
