package org.edgeweave.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Semaphore;

import org.edgeweave.runtime.model.Clock;

/**
 * A logical thread of test code.
 * <p>
 * Each tester thread is backed by a daemon OS thread that is parked on a single-permit gate
 * whenever it is not the one thread the scheduler has released. Exactly one tester thread runs
 * at any instant.
 * </p>
 * <p>
 * <b>Handoff protocol:</b> a running thread never touches scheduler state. Before yielding it
 * leaves its intent in this object (a block request, a join request, or the threads it spawned)
 * and releases the scheduler; the scheduler reads that intent after the handoff. The semaphore
 * handoff orders these plain field accesses.
 * </p>
 * Instances are normally created by {@link ThreadRegistry}.
 */
public final class TesterThread {

    private final int id;
    private final String name;
    private final TesterThread parent;
    private final ThreadBody body;
    private final Semaphore gate = new Semaphore(0);

    private Thread osThread;
    private volatile boolean done;
    private volatile boolean cancelled;
    private volatile Throwable failure;

    // Written by this thread before yielding, consumed by the scheduler
    private Clock blockRequest;
    private TesterThread joinRequest;
    private final List<TesterThread> spawned = new ArrayList<>();

    // Scheduler only
    private final List<TesterThread> joiners = new ArrayList<>();

    /**
     * Creates a tester thread. The backing OS thread is created by {@link #start(Runnable)}.
     *
     * @param id     Allocation-order identifier.
     * @param name   Diagnostic name.
     * @param parent The forking thread, or {@code null} for the main thread.
     * @param body   The code to run.
     */
    public TesterThread(int id, String name, TesterThread parent, ThreadBody body) {
        this.id = id;
        this.name = name;
        this.parent = parent;
        this.body = body;
    }

    public int getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public TesterThread getParent() {
        return parent;
    }

    /**
     * Returns whether the thread's body has returned, failed or been cancelled.
     *
     * @return {@code true} once the thread has finished.
     */
    public boolean isDone() {
        return done;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Returns the exception that terminated the body, if any. Cancellation is not a failure.
     *
     * @return The failure, or {@code null}.
     */
    public Throwable getFailure() {
        return failure;
    }

    /**
     * Returns whether the backing OS thread is still alive.
     *
     * @return {@code true} if the OS thread has been started and has not terminated.
     */
    public boolean isAlive() {
        return osThread != null && osThread.isAlive();
    }

    @Override
    public String toString() {
        return name + " (#" + id + ")";
    }

    ThreadBody getBody() {
        return body;
    }

    void start(Runnable wrapper) {
        if (osThread != null) {
            throw new IllegalStateException(this + " already started");
        }
        osThread = new Thread(wrapper, name);
        osThread.setDaemon(true);
        osThread.start();
    }

    boolean isOsThread(Thread thread) {
        return osThread == thread;
    }

    /**
     * Parks the calling OS thread until the scheduler releases this thread.
     *
     * @throws ThreadCancelledException if the thread was cancelled while parked
     */
    void awaitResume() {
        try {
            gate.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelled = true;
        }
        checkNotCancelled();
    }

    void release() {
        gate.release();
    }

    void checkNotCancelled() {
        if (cancelled) {
            throw new ThreadCancelledException(name);
        }
    }

    void cancel() {
        cancelled = true;
    }

    void interrupt() {
        if (osThread != null) {
            osThread.interrupt();
        }
    }

    boolean joinOsThread(long millis) {
        if (osThread == null) {
            return true;
        }
        try {
            osThread.join(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return !osThread.isAlive();
    }

    void markDone(Throwable failure) {
        this.failure = failure;
        this.done = true;
    }

    void requestBlock(Clock clock) {
        this.blockRequest = clock;
    }

    Clock takeBlockRequest() {
        Clock clock = blockRequest;
        blockRequest = null;
        return clock;
    }

    void requestJoin(TesterThread target) {
        this.joinRequest = target;
    }

    TesterThread takeJoinRequest() {
        TesterThread target = joinRequest;
        joinRequest = null;
        return target;
    }

    void addSpawned(TesterThread child) {
        spawned.add(child);
    }

    List<TesterThread> drainSpawned() {
        List<TesterThread> result = new ArrayList<>(spawned);
        spawned.clear();
        return result;
    }

    void addJoiner(TesterThread joiner) {
        joiners.add(joiner);
    }

    List<TesterThread> drainJoiners() {
        List<TesterThread> result = new ArrayList<>(joiners);
        joiners.clear();
        return result;
    }
}
