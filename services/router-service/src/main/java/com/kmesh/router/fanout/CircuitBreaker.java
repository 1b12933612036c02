package com.kmesh.router.fanout;

import java.util.function.LongSupplier;

/**
 * Per-agent breaker for recall calls. After {@code failureThreshold} consecutive failed recalls
 * the agent is skipped for {@code openDurationMs}. Once that elapses exactly one recall is
 * admitted as a trial: its success closes the breaker, its failure reopens it for another full
 * period. Other queries keep getting {@code false} while the trial is in flight.
 *
 * <p>An admitted call must end in {@link #recordSuccess()}, {@link #recordFailure()} or, when
 * it never reached the agent, {@link #release()}.
 */
public class CircuitBreaker {

    enum State {
        CLOSED,
        OPEN,
        TRIAL
    }

    private final int failureThreshold;
    private final long openDurationMs;
    private final LongSupplier clock;

    private State state = State.CLOSED;
    private int consecutiveFailures;
    private long openedAtMs;
    private boolean trialInFlight;

    public CircuitBreaker(int failureThreshold, long openDurationMs) {
        this(failureThreshold, openDurationMs, System::currentTimeMillis);
    }

    CircuitBreaker(int failureThreshold, long openDurationMs, LongSupplier clock) {
        this.failureThreshold = Math.max(1, failureThreshold);
        this.openDurationMs = Math.max(1L, openDurationMs);
        this.clock = clock;
    }

    public synchronized boolean tryAcquire() {
        switch (state) {
            case CLOSED:
                return true;
            case OPEN:
                if (clock.getAsLong() - openedAtMs < openDurationMs) {
                    return false;
                }
                state = State.TRIAL;
                trialInFlight = true;
                return true;
            default:
                if (trialInFlight) {
                    return false;
                }
                trialInFlight = true;
                return true;
        }
    }

    public synchronized void recordSuccess() {
        state = State.CLOSED;
        consecutiveFailures = 0;
        trialInFlight = false;
    }

    public synchronized void recordFailure() {
        if (state == State.TRIAL) {
            open();
            return;
        }
        consecutiveFailures++;
        if (state == State.CLOSED && consecutiveFailures >= failureThreshold) {
            open();
        }
    }

    /** Gives back an admission whose call was never sent, so a pending trial slot is not lost. */
    public synchronized void release() {
        if (state == State.TRIAL) {
            trialInFlight = false;
        }
    }

    synchronized State state() {
        return state;
    }

    private void open() {
        state = State.OPEN;
        openedAtMs = clock.getAsLong();
        consecutiveFailures = 0;
        trialInFlight = false;
    }
}
