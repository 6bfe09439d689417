package org.edgeweave.runtime;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

import org.edgeweave.runtime.model.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the tester threads of one run and performs the gate handoffs between them and the
 * scheduler.
 * <p>
 * <b>Synchronization protocol:</b>
 * <ol>
 *   <li>The scheduler marks a thread current, opens its gate and parks on the scheduler gate</li>
 *   <li>The thread runs test code until it blocks, joins or finishes</li>
 *   <li>To yield, the thread records its intent in its {@link TesterThread}, opens the scheduler
 *       gate and parks on its own gate; a finishing thread opens the scheduler gate last</li>
 *   <li>The scheduler wakes and acts on the recorded intent</li>
 * </ol>
 * <p>
 * <b>Thread safety:</b> the blocked-thread table is only mutated by the scheduler thread.
 * {@link #fork(ThreadBody)} and {@link #yieldToScheduler(TesterThread)} are called by the running
 * tester thread; they rely on the one-thread-runs-at-a-time invariant and never touch the
 * blocked-thread table.
 */
public class ThreadRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(ThreadRegistry.class);

    private final String threadNamePrefix;
    private final Semaphore schedulerGate = new Semaphore(0);
    private final List<TesterThread> allThreads = new ArrayList<>();
    private final Map<Clock, List<TesterThread>> blockedThreads = new LinkedHashMap<>();
    private final Queue<TesterThread> failedThreads = new ConcurrentLinkedQueue<>();
    private volatile TesterThread current;
    private int nextThreadId = 0;

    /**
     * Creates an empty registry.
     *
     * @param threadNamePrefix Prefix of the names given to tester threads.
     */
    public ThreadRegistry(String threadNamePrefix) {
        this.threadNamePrefix = threadNamePrefix;
    }

    /**
     * Creates the main tester thread. It is started parked and runs once the scheduler resumes it.
     *
     * @param body The test body.
     * @return The main thread.
     */
    public TesterThread spawnMain(ThreadBody body) {
        return spawn(body, null, threadNamePrefix + "-main");
    }

    /**
     * Creates a child of the currently running thread. The child is handed to the scheduler when
     * the parent yields.
     *
     * @param body The child's code.
     * @return The child thread.
     * @throws IllegalStateException if no tester thread is running
     */
    public TesterThread fork(ThreadBody body) {
        TesterThread parent = current;
        if (parent == null) {
            throw new IllegalStateException("fork requires a running tester thread");
        }
        TesterThread child = spawn(body, parent, null);
        parent.addSpawned(child);
        LOG.debug("{} forked {}", parent, child);
        return child;
    }

    private TesterThread spawn(ThreadBody body, TesterThread parent, String name) {
        int id = nextThreadId++;
        TesterThread thread = new TesterThread(id, name != null ? name : threadNamePrefix + "-" + id, parent, body);
        allThreads.add(thread);
        thread.start(() -> runThread(thread));
        return thread;
    }

    /**
     * The code executed on each tester thread's OS thread.
     *
     * @param thread The tester thread being run.
     */
    private void runThread(TesterThread thread) {
        Throwable failure = null;
        try {
            thread.awaitResume();
            thread.getBody().run();
        } catch (ThreadCancelledException e) {
            LOG.debug("{} cancelled", thread);
        } catch (Throwable t) {
            if (thread.isCancelled()) {
                LOG.debug("{} failed while being cancelled: {}", thread, t.toString());
            } else {
                LOG.debug("{} failed: {}", thread, t.toString());
                failure = t;
            }
        } finally {
            thread.markDone(failure);
            if (failure != null) {
                failedThreads.offer(thread);
            }
            schedulerGate.release();
        }
    }

    /**
     * Called by a running tester thread after it recorded its intent. Returns when the scheduler
     * resumes the thread again.
     *
     * @param thread The calling thread.
     * @throws ThreadCancelledException if the thread is cancelled while parked
     */
    public void yieldToScheduler(TesterThread thread) {
        schedulerGate.release();
        thread.awaitResume();
    }

    /**
     * Runs the given thread until it yields or finishes. Scheduler thread only.
     *
     * @param thread The thread to resume.
     */
    public void resume(TesterThread thread) {
        if (thread.isDone()) {
            throw new IllegalStateException("Cannot resume finished thread " + thread);
        }
        current = thread;
        thread.release();
        schedulerGate.acquireUninterruptibly();
        current = null;
    }

    /**
     * Returns the tester thread that is currently released, if any.
     *
     * @return The running thread, or {@code null} while the scheduler runs.
     */
    public TesterThread current() {
        return current;
    }

    /**
     * Registers a thread as waiting for the next rising edge of a clock.
     *
     * @param thread The blocked thread.
     * @param clock  The clock it waits on.
     * @throws IllegalStateException if the thread is already blocked
     */
    public void block(TesterThread thread, Clock clock) {
        for (List<TesterThread> waiting : blockedThreads.values()) {
            if (waiting.contains(thread)) {
                throw new IllegalStateException(thread + " is already blocked");
            }
        }
        blockedThreads.computeIfAbsent(clock, k -> new ArrayList<>()).add(thread);
    }

    /**
     * Removes and returns the threads waiting on a clock, in blocking order.
     *
     * @param clock The clock that fired.
     * @return The threads that were waiting, possibly empty.
     */
    public List<TesterThread> unblock(Clock clock) {
        List<TesterThread> waiting = blockedThreads.remove(clock);
        return waiting == null ? List.of() : waiting;
    }

    /**
     * Returns the clocks that currently have at least one waiting thread.
     *
     * @return An unmodifiable view of the waited-on clocks, in first-block order.
     */
    public Set<Clock> blockedClocks() {
        return Collections.unmodifiableSet(blockedThreads.keySet());
    }

    /**
     * Returns the threads waiting on a clock without removing them.
     *
     * @param clock The clock.
     * @return An unmodifiable list of waiting threads.
     */
    public List<TesterThread> blockedOn(Clock clock) {
        return Collections.unmodifiableList(blockedThreads.getOrDefault(clock, List.of()));
    }

    public boolean hasBlockedThreads() {
        return !blockedThreads.isEmpty();
    }

    /**
     * Returns every thread created in this run, in creation order.
     *
     * @return An unmodifiable view of all threads.
     */
    public List<TesterThread> allThreads() {
        return Collections.unmodifiableList(allThreads);
    }

    /**
     * Removes and returns the threads that terminated with an exception, in completion order.
     *
     * @return The failed threads.
     */
    public List<TesterThread> drainFailedThreads() {
        List<TesterThread> failed = new ArrayList<>();
        TesterThread thread;
        while ((thread = failedThreads.poll()) != null) {
            failed.add(thread);
        }
        return failed;
    }

    /**
     * Cancels every live thread and waits for it to unwind. Scheduler thread only.
     * <p>
     * Each thread is flagged and resumed so that it raises {@link ThreadCancelledException} at
     * its suspension point. If a thread has not finished within {@code timeout}, its OS thread is
     * interrupted as a last resort.
     *
     * @param timeout How long to wait for each thread to unwind.
     */
    public void cancelAll(Duration timeout) {
        blockedThreads.clear();
        for (TesterThread thread : new ArrayList<>(allThreads)) {
            if (thread.isDone()) {
                thread.joinOsThread(timeout.toMillis());
                continue;
            }
            LOG.debug("Cancelling {}", thread);
            thread.cancel();
            current = thread;
            thread.release();
            boolean finished = awaitScheduler(timeout);
            if (!finished) {
                LOG.warn("Tester thread {} did not stop within {} ms after cancellation, interrupting it",
                        thread, timeout.toMillis());
                thread.interrupt();
                awaitScheduler(timeout);
            }
            current = null;
            if (!thread.joinOsThread(timeout.toMillis())) {
                LOG.warn("Tester thread {} is still alive after teardown", thread);
            }
        }
    }

    private boolean awaitScheduler(Duration timeout) {
        try {
            return schedulerGate.tryAcquire(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
