package org.edgeweave.runtime.checker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.math.BigInteger;
import java.util.List;

import org.edgeweave.junit.extensions.logging.ExpectLog;
import org.edgeweave.junit.extensions.logging.LogLevel;
import org.edgeweave.junit.extensions.logging.LogWatchExtension;
import org.edgeweave.runtime.TesterThread;
import org.edgeweave.runtime.model.Clock;
import org.edgeweave.runtime.model.PortNameMap;
import org.edgeweave.runtime.model.Signal;
import org.edgeweave.runtime.spi.IResultCollector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;

/**
 * Unit tests for {@link ThreadingChecker}: poke arbitration, peek ordering and windows.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ThreadingCheckerTest {

    private static final Clock MAIN = Clock.of("clock");
    private static final Clock CLK_B = Clock.of("clk_b");
    private static final Signal IN = Signal.of("in");

    private IResultCollector collector;
    private ThreadingChecker checker;
    private TesterThread a;
    private TesterThread b;

    @BeforeEach
    void setUp() {
        collector = mock(IResultCollector.class);
        checker = new ThreadingChecker(MAIN, PortNameMap.identity(), collector);
        a = new TesterThread(1, "a", null, () -> { });
        b = new TesterThread(2, "b", null, () -> { });
        checker.enterWindow(a, MAIN);
        checker.enterWindow(b, MAIN);
    }

    @Test
    void firstPokeIsApplied() {
        assertThat(poke(a, 5, 0)).isTrue();
        assertThat(checker.pokesOf(IN)).extracting(PokeRecord::resolution)
            .containsExactly(PokeResolution.APPLIED);
    }

    @Test
    void lowerPriorityNumberOverridesAndHigherIsDropped() {
        assertThat(poke(a, 1, 2)).isTrue();
        assertThat(poke(b, 2, 1)).isTrue();
        assertThat(poke(a, 3, 2)).isFalse();

        assertThat(checker.pokesOf(IN)).extracting(PokeRecord::resolution).containsExactly(
            PokeResolution.APPLIED, PokeResolution.APPLIED, PokeResolution.LOST_LOWER_PRIORITY_WON);
        verify(collector, never()).recordConflict(any());
    }

    @Test
    void sameThreadMayRepokeAtEqualPriority() {
        assertThat(poke(a, 1, 0)).isTrue();
        assertThat(poke(a, 2, 0)).isTrue();

        verify(collector, never()).recordConflict(any());
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Signal 'in' poked at equal priority by a and b in timestep 0")
    void equalPriorityFromAnotherThreadIsConflict() {
        assertThat(poke(a, 1, 0)).isTrue();
        assertThat(poke(b, 2, 0)).isFalse();

        ArgumentCaptor<ThreadOrderDependentException> captor =
            ArgumentCaptor.forClass(ThreadOrderDependentException.class);
        verify(collector).recordConflict(captor.capture());
        ThreadOrderDependentException conflict = captor.getValue();
        assertThat(conflict.getKind()).isEqualTo(ThreadOrderDependentException.Kind.POKE_PRIORITY_TIE);
        assertThat(conflict.getSignalName()).isEqualTo("in");
        assertThat(conflict.getFirstThread()).isEqualTo("a");
        assertThat(conflict.getSecondThread()).isEqualTo("b");
        assertThat(conflict.getTimestep()).isZero();
        assertThat(checker.pokesOf(IN).get(1).resolution()).isEqualTo(PokeResolution.LOST_PRIORITY_CONFLICT);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Signal 'dut.io_in' poked at equal priority by a and b in timestep 0")
    void handlesMappedToOnePortAreArbitratedTogether() {
        PortNameMap aliased = PortNameMap.builder().map(IN, "dut.io_in").withIdentityFallback().build();
        ThreadingChecker aliasing = new ThreadingChecker(MAIN, aliased, collector);
        aliasing.enterWindow(a, MAIN);
        aliasing.enterWindow(b, MAIN);

        assertThat(aliasing.doPoke(IN, BigInteger.ONE, 0, a, new Throwable("poke"))).isTrue();
        assertThat(aliasing.doPoke(Signal.of("dut.io_in"), BigInteger.TWO, 0, b, new Throwable("poke"))).isFalse();

        verify(collector).recordConflict(any());
        assertThat(aliasing.pokesOf(Signal.of("dut.io_in"))).hasSize(2);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Signal 'clk_b' peeked by a before b poked it in timestep 0")
    void signalAndClockOfSameNameShareOnePort() {
        checker.doPeek(Signal.of("clk_b"), a, new Throwable("peek"));
        checker.doPoke(CLK_B, BigInteger.ONE, 0, b, new Throwable("poke"));

        List<ThreadOrderDependentException> violations = checker.finishTimestep();

        assertThat(violations).extracting(ThreadOrderDependentException::getKind)
            .containsExactly(ThreadOrderDependentException.Kind.PEEK_BEFORE_POKE);
    }

    @Test
    void pokesInDifferentWindowsNeverConflict() {
        checker.newTimestep(CLK_B);
        checker.enterWindow(b, CLK_B);

        assertThat(poke(a, 1, 0)).isTrue();
        assertThat(poke(b, 2, 0)).isTrue();

        verify(collector, never()).recordConflict(any());
        assertThat(checker.windowOf(b)).isEqualTo(CLK_B);
    }

    @Test
    void enteringUnopenedWindowFails() {
        assertThatThrownBy(() -> checker.enterWindow(a, CLK_B))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("clk_b");
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Signal 'in' peeked by a before b poked it in timestep 0")
    void peekBeforeForeignPokeIsReportedAtEndOfTimestep() {
        checker.doPeek(IN, a, new Throwable("peek"));
        poke(b, 7, 0);

        List<ThreadOrderDependentException> violations = checker.finishTimestep();

        assertThat(violations).hasSize(1);
        assertThat(violations.get(0).getKind()).isEqualTo(ThreadOrderDependentException.Kind.PEEK_BEFORE_POKE);
        assertThat(violations.get(0).getFirstThread()).isEqualTo("a");
        assertThat(violations.get(0).getSecondThread()).isEqualTo("b");
        verify(collector).recordConflict(violations.get(0));
    }

    @Test
    void peekAfterForeignPokeIsFine() {
        poke(b, 7, 0);
        checker.doPeek(IN, a, new Throwable("peek"));

        assertThat(checker.finishTimestep()).isEmpty();
    }

    @Test
    void peekBeforeOwnPokeIsFine() {
        checker.doPeek(IN, a, new Throwable("peek"));
        poke(a, 7, 0);

        assertThat(checker.finishTimestep()).isEmpty();
    }

    @Test
    void droppedPokeDoesNotInvalidateEarlierPeek() {
        poke(b, 7, 0);
        checker.doPeek(IN, a, new Throwable("peek"));
        poke(b, 9, 3);

        assertThat(checker.finishTimestep()).isEmpty();
    }

    @Test
    void finishTimestepClearsLogAndWindows() {
        checker.newTimestep(CLK_B);
        poke(a, 1, 0);
        checker.doPeek(IN, a, new Throwable("peek"));

        checker.finishTimestep();

        assertThat(checker.getTimestep()).isEqualTo(1);
        assertThat(checker.pokesOf(IN)).isEmpty();
        assertThat(checker.peeksOf(IN)).isEmpty();
        assertThat(checker.windowOf(b)).isEqualTo(MAIN);
        assertThatThrownBy(() -> checker.enterWindow(b, CLK_B)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void finishThreadLeavesWindow() {
        checker.newTimestep(CLK_B);
        checker.enterWindow(a, CLK_B);

        checker.finishThread(a, MAIN);

        assertThat(checker.windowOf(a)).isEqualTo(MAIN);
    }

    private boolean poke(TesterThread issuer, long value, int priority) {
        return checker.doPoke(IN, BigInteger.valueOf(value), priority, issuer, new Throwable("poke"));
    }
}
