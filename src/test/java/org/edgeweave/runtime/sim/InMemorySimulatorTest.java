package org.edgeweave.runtime.sim;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link InMemorySimulator}.
 */
@Tag("unit")
class InMemorySimulatorTest {

    @Test
    void period2ClockRisesOnOddCycles() {
        InMemorySimulator sim = new InMemorySimulator().addClock("clk_a", 2);

        List<Long> levels = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            levels.add(sim.peekLong("clk_a"));
            sim.step(1);
        }

        assertThat(levels).containsExactly(0L, 1L, 0L, 1L, 0L, 1L);
    }

    @Test
    void period4ClockIsHighInSecondHalfOfPeriod() {
        InMemorySimulator sim = new InMemorySimulator().addClock("clk_b", 4);

        List<Long> levels = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            levels.add(sim.peekLong("clk_b"));
            sim.step(1);
        }

        assertThat(levels).containsExactly(0L, 0L, 1L, 1L, 0L, 0L, 1L, 1L);
        assertThat(sim.getCycle()).isEqualTo(8);
    }

    @Test
    void registersUpdateSimultaneously() {
        InMemorySimulator sim = new InMemorySimulator()
            .addRegister("a", BigInteger.ONE, s -> s.peek("b"))
            .addRegister("b", BigInteger.TWO, s -> s.peek("a"));

        sim.step(1);

        assertThat(sim.peekLong("a")).isEqualTo(2);
        assertThat(sim.peekLong("b")).isEqualTo(1);
    }

    @Test
    void combinationalOutputFollowsInputsWithoutStepping() {
        InMemorySimulator sim = new InMemorySimulator()
            .addInput("in", 0)
            .addOutput("out", s -> s.peek("in").add(BigInteger.ONE));

        sim.poke("in", BigInteger.valueOf(41));

        assertThat(sim.peekLong("out")).isEqualTo(42);
        assertThat(sim.getCycle()).isZero();
    }

    @Test
    void onlyInputsCanBePoked() {
        InMemorySimulator sim = new InMemorySimulator()
            .addClock("clk", 2)
            .addRegister("q", BigInteger.ZERO, s -> BigInteger.ZERO);

        assertThatThrownBy(() -> sim.poke("q", BigInteger.ONE))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("not an input");
        assertThatThrownBy(() -> sim.poke("clk", BigInteger.ONE))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unknownPortIsRejected() {
        InMemorySimulator sim = new InMemorySimulator();

        assertThatThrownBy(() -> sim.peek("missing"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unknown port 'missing'");
    }

    @Test
    void invalidDeclarationsAreRejected() {
        InMemorySimulator sim = new InMemorySimulator().addInput("in", 0);

        assertThatThrownBy(() -> sim.addClock("clk", 3)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> sim.addClock("clk", 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> sim.addInput("in", 1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("already declared");
        assertThatThrownBy(() -> sim.step(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
