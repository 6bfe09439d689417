package org.edgeweave.runtime;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.edgeweave.runtime.checker.ThreadingChecker;
import org.edgeweave.runtime.model.Clock;
import org.edgeweave.runtime.model.PortNameMap;
import org.edgeweave.runtime.model.Signal;
import org.edgeweave.runtime.spi.ICheckpointHook;
import org.edgeweave.runtime.spi.ISimulator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one test against a simulator as a set of cooperatively scheduled tester threads.
 * <p>
 * Test code is written sequentially: it pokes inputs, peeks outputs and calls
 * {@link #step(Clock, int)} to wait for clock edges. {@link #fork(ThreadBody)} starts further
 * threads that run "concurrently" with their parent. Only one tester thread ever executes at a
 * time; the run loop decides who runs next.
 * <p>
 * <b>Timestep cycle:</b>
 * <ol>
 *   <li>Resolve edges: every thread waiting on the main clock is released (the main clock fires
 *       once per timestep by construction), then every tracked dependent clock is sampled and the
 *       waiters of each clock that rose are released</li>
 *   <li>Run threads: released threads are resumed one at a time in blocking order; each runs
 *       until it blocks again, joins, or finishes. Threads forked or released by a join in this
 *       timestep are appended to the queue</li>
 *   <li>Commit: the {@link ThreadingChecker} validates the timestep; then the checkpoint hook is
 *       called and the simulator stepped by one cycle, unless the main thread just finished</li>
 * </ol>
 * When the main thread is done, every remaining thread is cancelled and its OS thread ends
 * before {@link #run} returns.
 * <p>
 * <b>Determinism:</b> given the same test code, threads are resumed in the same order on every
 * execution, independent of the JVM's thread scheduler.
 * <p>
 * A tester runs a single test. Create a new instance per test.
 *
 * @param <T> The type of the device-under-test handle passed to the test body.
 */
public class ThreadedTester<T> {

    private static final Logger LOG = LoggerFactory.getLogger(ThreadedTester.class);

    private final T dut;
    private final ISimulator simulator;
    private final PortNameMap ports;
    private final TesterOptions options;
    private final Clock mainClock;
    private final ThreadRegistry registry;
    private final ClockTracker clockTracker;

    private volatile SchedulerState state = SchedulerState.IDLE;
    private boolean started = false;
    private TesterContext context;
    private ThreadingChecker checker;
    private long timestep = 0L;
    private long committedTimesteps = 0L;
    private int idleTimesteps = 0;

    /**
     * Creates a tester with the default options from {@code reference.conf}.
     *
     * @param dut       The device-under-test handle passed to the test body.
     * @param simulator The simulator to drive.
     * @param ports     Maps signal handles to simulator ports.
     */
    public ThreadedTester(T dut, ISimulator simulator, PortNameMap ports) {
        this(dut, simulator, ports, TesterOptions.defaults());
    }

    /**
     * Creates a tester.
     *
     * @param dut       The device-under-test handle passed to the test body.
     * @param simulator The simulator to drive.
     * @param ports     Maps signal handles to simulator ports.
     * @param options   Tester settings.
     */
    public ThreadedTester(T dut, ISimulator simulator, PortNameMap ports, TesterOptions options) {
        this.dut = dut;
        this.simulator = simulator;
        this.ports = ports;
        this.options = options;
        this.mainClock = Clock.of(options.getMainClock());
        this.registry = new ThreadRegistry(options.getThreadNamePrefix());
        this.clockTracker = new ClockTracker(simulator, ports, mainClock);
    }

    /**
     * Runs a test, collecting its outcomes into a fresh {@link TestResults}.
     *
     * @param body The test body, run as the main thread.
     * @return The expectation outcomes and conflicts of the run.
     * @throws TesterThreadException if any tester thread failed
     * @throws DeadlockException     if the run stalled before the main thread finished
     */
    public TestResults run(TestBody<T> body) {
        TestResults results = new TestResults();
        run(TesterContext.of(results), body);
        return results;
    }

    /**
     * Runs a test: asserts reset for one cycle, then runs timesteps until the main thread is done.
     *
     * @param context Where outcomes are reported and which checkpoint hook is called.
     * @param body    The test body, run as the main thread.
     * @throws TesterThreadException if any tester thread failed
     * @throws DeadlockException     if the run stalled before the main thread finished
     * @throws IllegalStateException if this tester already ran
     */
    public void run(TesterContext context, TestBody<T> body) {
        if (started) {
            throw new IllegalStateException("A ThreadedTester runs a single test; create a new instance");
        }
        started = true;
        this.context = context;
        this.checker = new ThreadingChecker(mainClock, ports, context.getResultCollector());

        LOG.info("Starting test on main clock '{}'", ports.displayName(mainClock));
        simulator.poke(options.getResetPort(), BigInteger.ONE);
        simulator.step(1);
        simulator.poke(options.getResetPort(), BigInteger.ZERO);

        TesterThread mainThread = registry.spawnMain(() -> body.run(dut));
        registry.block(mainThread, mainClock);

        try {
            while (!mainThread.isDone()) {
                runTimestep(mainThread);
            }
        } finally {
            state = SchedulerState.FINISHED;
            registry.cancelAll(options.getTeardownTimeout());
        }

        List<TesterThread> failed = registry.drainFailedThreads();
        if (!failed.isEmpty()) {
            LOG.info("Test finished after {} committed timestep(s) with {} failed thread(s)",
                    committedTimesteps, failed.size());
            throw new TesterThreadException(failed);
        }
        LOG.info("Test finished after {} committed timestep(s)", committedTimesteps);
    }

    private void runTimestep(TesterThread mainThread) {
        state = SchedulerState.RESOLVING_EDGES;
        List<TesterThread> runnable = resolveEdges();
        if (runnable.isEmpty()) {
            idleTimesteps++;
            int limit = options.getIdleTimestepLimit();
            if (limit > 0 && idleTimesteps >= limit) {
                throw new DeadlockException("No tester thread was resumed for " + idleTimesteps
                        + " consecutive timesteps (waiting on " + describeBlocked() + ")");
            }
        } else {
            idleTimesteps = 0;
        }

        state = SchedulerState.RUNNING_THREADS;
        runThreads(runnable);

        state = SchedulerState.COMMITTING;
        checker.finishTimestep();
        if (mainThread.isDone()) {
            LOG.debug("Timestep {}: {} finished", timestep, mainThread);
            timestep++;
            return;
        }
        if (!registry.hasBlockedThreads()) {
            throw new DeadlockException("Timestep " + timestep + ": " + mainThread
                    + " has not finished but no tester thread waits on a clock");
        }
        checkpoint();
        simulator.step(1);
        committedTimesteps++;
        timestep++;
        state = SchedulerState.IDLE;
    }

    /**
     * Collects the threads released in this timestep, main clock waiters first.
     *
     * @return The threads to run, in resume order.
     */
    private List<TesterThread> resolveEdges() {
        List<TesterThread> unblocked = new ArrayList<>();
        for (TesterThread thread : registry.unblock(mainClock)) {
            checker.enterWindow(thread, mainClock);
            unblocked.add(thread);
        }
        clockTracker.recordEdge(mainClock);

        Set<Clock> waitedClocks = new LinkedHashSet<>(registry.blockedClocks());
        for (Clock clock : waitedClocks) {
            if (!clockTracker.isTracked(clock)) {
                throw new IllegalStateException("Threads are blocked on untracked clock '"
                        + ports.displayName(clock) + "'");
            }
        }
        clockTracker.retainOnly(waitedClocks);

        for (Clock clock : clockTracker.trackedClocks()) {
            if (clockTracker.rose(clock)) {
                checker.newTimestep(clock);
                clockTracker.recordEdge(clock);
                for (TesterThread thread : registry.unblock(clock)) {
                    checker.enterWindow(thread, clock);
                    unblocked.add(thread);
                }
            }
        }

        if (LOG.isDebugEnabled()) {
            LOG.debug("Timestep {}: resuming {}", timestep, unblocked);
        }
        return unblocked;
    }

    private void runThreads(List<TesterThread> released) {
        Deque<TesterThread> queue = new ArrayDeque<>(released);
        while (!queue.isEmpty()) {
            TesterThread thread = queue.poll();
            registry.resume(thread);
            Clock window = checker.windowOf(thread);

            for (TesterThread child : thread.drainSpawned()) {
                checker.enterWindow(child, window);
                queue.add(child);
            }

            if (thread.isDone()) {
                checker.finishThread(thread, null);
                for (TesterThread joiner : thread.drainJoiners()) {
                    checker.enterWindow(joiner, window);
                    queue.add(joiner);
                }
                LOG.debug("Timestep {}: {} finished", timestep, thread);
                continue;
            }

            Clock clock = thread.takeBlockRequest();
            if (clock != null) {
                checker.finishThread(thread, clock);
                clockTracker.track(clock);
                registry.block(thread, clock);
                continue;
            }

            TesterThread target = thread.takeJoinRequest();
            if (target != null) {
                if (target.isDone()) {
                    queue.add(thread);
                } else {
                    target.addJoiner(thread);
                }
                continue;
            }

            throw new IllegalStateException(thread + " yielded without blocking, joining or finishing");
        }
    }

    private void checkpoint() {
        ICheckpointHook hook = context.getCheckpointHook();
        try {
            hook.checkpoint(timestep);
        } catch (Exception e) {
            LOG.warn("Checkpoint hook '{}' failed at timestep {}: {}",
                    hook.getClass().getSimpleName(), timestep, e.getMessage());
        }
    }

    private String describeBlocked() {
        StringBuilder sb = new StringBuilder();
        for (Clock clock : registry.blockedClocks()) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(ports.displayName(clock)).append('=').append(registry.blockedOn(clock));
        }
        return sb.length() == 0 ? "nothing" : sb.toString();
    }

    // ==================== Test code API ====================

    /**
     * Drives a signal at the default priority.
     *
     * @param signal The signal.
     * @param value  The value.
     */
    public void poke(Signal signal, BigInteger value) {
        poke(signal, value, options.getDefaultPokePriority());
    }

    public void poke(Signal signal, long value) {
        poke(signal, BigInteger.valueOf(value));
    }

    public void poke(Signal signal, long value, int priority) {
        poke(signal, BigInteger.valueOf(value), priority);
    }

    /**
     * Drives a signal. Among pokes of the same signal in one timestep the lowest numeric priority
     * wins; a dominated poke never reaches the simulator. Two threads poking at the same priority
     * is recorded as a conflict and the second poke is dropped.
     *
     * @param signal   The signal.
     * @param value    The value.
     * @param priority The priority; lower numbers win.
     * @throws IllegalStateException    if not called from the running tester thread
     * @throws IllegalArgumentException if the signal has no simulator port
     */
    public void poke(Signal signal, BigInteger value, int priority) {
        TesterThread thread = requireCurrentThread();
        String port = ports.portFor(signal);
        Throwable callSite = new Throwable(thread.getName() + " poked '" + ports.displayName(signal) + "'");
        if (checker.doPoke(signal, value, priority, thread, callSite)) {
            simulator.poke(port, value);
        }
    }

    /**
     * Reads the current value of a signal.
     *
     * @param signal The signal.
     * @return The value the simulator reports.
     */
    public BigInteger peek(Signal signal) {
        return peek(signal, false);
    }

    /**
     * Reads a signal.
     *
     * @param signal The signal.
     * @param stale  Whether the value from before the latest poke in this timestep is wanted.
     * @return The value the simulator reports.
     * @throws StalePeekException    if {@code stale} is requested
     * @throws IllegalStateException if not called from the running tester thread
     */
    public BigInteger peek(Signal signal, boolean stale) {
        TesterThread thread = requireCurrentThread();
        if (stale) {
            throw new StalePeekException(ports.displayName(signal));
        }
        String port = ports.portFor(signal);
        checker.doPeek(signal, thread, new Throwable(thread.getName() + " peeked '" + ports.displayName(signal) + "'"));
        return simulator.peek(port);
    }

    public void expect(Signal signal, long expected) {
        expect(signal, BigInteger.valueOf(expected), null);
    }

    public void expect(Signal signal, long expected, String message) {
        expect(signal, BigInteger.valueOf(expected), message);
    }

    public void expect(Signal signal, BigInteger expected) {
        expect(signal, expected, null);
    }

    /**
     * Peeks a signal and compares it with an expected value. A mismatch is recorded as an
     * {@link ExpectationFailure}; it does not stop the run.
     *
     * @param signal   The signal.
     * @param expected The expected value.
     * @param message  Optional text attached to a failure, may be {@code null}.
     */
    public void expect(Signal signal, BigInteger expected, String message) {
        BigInteger actual = peek(signal);
        String name = ports.displayName(signal);
        if (actual.equals(expected)) {
            context.getResultCollector().recordExpectationPassed(name);
            return;
        }
        ExpectationFailure failure = new ExpectationFailure(
                name, expected, actual, timestep, registry.current().getName(), message);
        LOG.warn("{}", failure.describe());
        context.getResultCollector().recordExpectationFailure(failure);
    }

    /**
     * Waits for the given number of main clock cycles.
     *
     * @param cycles The number of cycles, &gt;= 0.
     */
    public void step(int cycles) {
        step(mainClock, cycles);
    }

    /**
     * Suspends the calling thread until the given clock has risen {@code cycles} times.
     *
     * @param clock  The clock to wait on.
     * @param cycles The number of rising edges, &gt;= 0.
     * @throws IllegalArgumentException if {@code cycles} is negative or the clock has no port
     * @throws IllegalStateException    if not called from the running tester thread
     */
    public void step(Clock clock, int cycles) {
        if (cycles < 0) {
            throw new IllegalArgumentException("cycles must be >= 0, got " + cycles);
        }
        TesterThread thread = requireCurrentThread();
        if (!clock.equals(mainClock)) {
            ports.portFor(clock);
        }
        for (int i = 0; i < cycles; i++) {
            thread.checkNotCancelled();
            thread.requestBlock(clock);
            registry.yieldToScheduler(thread);
        }
    }

    /**
     * Starts a new tester thread. It first runs in the current timestep, after the caller and
     * every thread already queued for this timestep have yielded.
     *
     * @param body The thread's code.
     * @return The new thread, usable with {@link #join(TesterThread)}.
     */
    public TesterThread fork(ThreadBody body) {
        requireCurrentThread();
        return registry.fork(body);
    }

    /**
     * Suspends the calling thread until another thread has finished. The caller resumes in the
     * timestep in which the other thread finished.
     *
     * @param target The thread to wait for.
     * @throws IllegalArgumentException if a thread tries to join itself
     */
    public void join(TesterThread target) {
        TesterThread thread = requireCurrentThread();
        if (target == thread) {
            throw new IllegalArgumentException(thread + " cannot join itself");
        }
        if (target.isDone()) {
            return;
        }
        thread.requestJoin(target);
        registry.yieldToScheduler(thread);
        if (!target.isDone()) {
            throw new IllegalStateException(thread + " resumed before " + target + " finished");
        }
    }

    /**
     * Waits for several threads, in order.
     *
     * @param targets The threads to wait for.
     */
    public void join(List<TesterThread> targets) {
        for (TesterThread target : targets) {
            join(target);
        }
    }

    private TesterThread requireCurrentThread() {
        TesterThread thread = registry.current();
        if (thread == null || !thread.isOsThread(Thread.currentThread())) {
            throw new IllegalStateException("Tester operations must be called from the running tester thread");
        }
        thread.checkNotCancelled();
        return thread;
    }

    // ==================== Introspection ====================

    /**
     * Returns the tester thread executing the caller, or {@code null} when called from any other
     * thread.
     *
     * @return The current tester thread.
     */
    public TesterThread currentThread() {
        TesterThread thread = registry.current();
        return thread != null && thread.isOsThread(Thread.currentThread()) ? thread : null;
    }

    /**
     * Returns the number of rising edges of a clock the scheduler has acted upon. For the main
     * clock this is the number of timesteps entered so far.
     *
     * @param clock The clock.
     * @return The edge count.
     */
    public long getClockCycle(Clock clock) {
        return clockTracker.getClockCycle(clock);
    }

    public Clock getMainClock() {
        return mainClock;
    }

    /**
     * Returns the number of timesteps that stepped the simulator, excluding the reset cycle.
     *
     * @return The committed timestep count.
     */
    public long getCommittedTimesteps() {
        return committedTimesteps;
    }

    /**
     * Returns the index of the current timestep, starting at 0.
     *
     * @return The timestep index.
     */
    public long getTimestep() {
        return timestep;
    }

    public SchedulerState getState() {
        return state;
    }

    /**
     * Returns every tester thread created by the run, in creation order.
     *
     * @return An unmodifiable view of the threads.
     */
    public List<TesterThread> getThreads() {
        return registry.allThreads();
    }

    public TesterOptions getOptions() {
        return options;
    }
}
