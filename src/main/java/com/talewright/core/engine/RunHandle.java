package com.talewright.core.engine;

import com.talewright.core.state.RunState;

import java.util.concurrent.TimeUnit;

/**
 * Registry entry for one run: its state, the serialized state at its last checkpoint, and
 * whether an execution currently holds the run.
 * <p>
 * The executing flag enforces the single-writer rule; it is only changed under this object's
 * monitor, and waiters are notified when an execution ends.
 */
public class RunHandle {

    private final RunState state;
    private volatile String lastCheckpoint;
    private boolean executing;

    public RunHandle(RunState state, String initialCheckpoint) {
        this.state = state;
        this.lastCheckpoint = initialCheckpoint;
    }

    public RunState state() {
        return state;
    }

    public String runId() {
        return state.getRunId();
    }

    public String lastCheckpoint() {
        return lastCheckpoint;
    }

    void recordCheckpoint(String serializedState) {
        this.lastCheckpoint = serializedState;
    }

    public synchronized boolean isExecuting() {
        return executing;
    }

    /**
     * Claims the run for a new execution.
     *
     * @return false if another execution already holds it
     */
    synchronized boolean tryClaim() {
        if (executing) {
            return false;
        }
        executing = true;
        return true;
    }

    /**
     * Clears the pause flag and claims the run if no execution holds it. When an execution is
     * still unwinding from the pause, it sees the cleared flag on release and keeps going.
     *
     * @return true if the caller must launch a new execution
     */
    synchronized boolean resumeAndClaim() {
        state.setPaused(false);
        return tryClaim();
    }

    /**
     * Releases the run after an execution ends. If the run was resumed while the execution was
     * unwinding from a pause, the claim is kept and true is returned so the caller relaunches.
     */
    synchronized boolean releaseOrKeepForResume(boolean stoppedForPause) {
        boolean relaunch = stoppedForPause && !state.isPaused() && !state.isTerminal();
        if (!relaunch) {
            executing = false;
            notifyAll();
        }
        return relaunch;
    }

    /**
     * Waits until no execution holds the run.
     *
     * @return true if idle, false if the timeout elapsed first
     */
    synchronized boolean awaitIdle(long timeout, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (executing) {
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMs <= 0) {
                return false;
            }
            wait(remainingMs);
        }
        return true;
    }
}
