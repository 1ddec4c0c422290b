package fr.lapetina.inference.mesh.infrastructure.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Protects an inference backend from being hammered while it is failing.
 *
 * States:
 * - CLOSED: calls pass through
 * - OPEN: too many consecutive failures, calls are refused until the recovery timeout elapses
 * - HALF_OPEN: trial calls pass; enough successes close the circuit, one failure reopens it
 */
public final class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final String backend;
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final int halfOpenSuccessThreshold;
    private final Clock clock;

    private final AtomicReference<State> state = new AtomicReference<>(State.CLOSED);
    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    private final AtomicInteger halfOpenSuccesses = new AtomicInteger(0);
    private volatile Instant openedAt;

    public CircuitBreaker(
            String backend,
            int failureThreshold,
            Duration recoveryTimeout,
            int halfOpenSuccessThreshold,
            Clock clock
    ) {
        if (failureThreshold < 1 || halfOpenSuccessThreshold < 1) {
            throw new IllegalArgumentException("Thresholds must be at least 1");
        }
        this.backend = backend;
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = recoveryTimeout;
        this.halfOpenSuccessThreshold = halfOpenSuccessThreshold;
        this.clock = clock;
    }

    public CircuitBreaker(String backend, int failureThreshold, Duration recoveryTimeout) {
        this(backend, failureThreshold, recoveryTimeout, 1, Clock.systemUTC());
    }

    /**
     * @return true if a call may proceed
     */
    public boolean tryAcquire() {
        return currentState() != State.OPEN;
    }

    public void onSuccess() {
        State current = state.get();
        if (current == State.CLOSED) {
            consecutiveFailures.set(0);
        } else if (current == State.HALF_OPEN
                && halfOpenSuccesses.incrementAndGet() >= halfOpenSuccessThreshold
                && state.compareAndSet(State.HALF_OPEN, State.CLOSED)) {
            consecutiveFailures.set(0);
            log.info("Circuit closed: backend={}", backend);
        }
    }

    public void onFailure() {
        State current = state.get();
        if (current == State.HALF_OPEN) {
            if (state.compareAndSet(State.HALF_OPEN, State.OPEN)) {
                openedAt = clock.instant();
                log.warn("Circuit reopened after trial failure: backend={}", backend);
            }
            return;
        }
        if (current == State.CLOSED) {
            int failures = consecutiveFailures.incrementAndGet();
            if (failures >= failureThreshold && state.compareAndSet(State.CLOSED, State.OPEN)) {
                openedAt = clock.instant();
                log.warn("Circuit opened: backend={}, failures={}", backend, failures);
            }
        }
    }

    /**
     * Current state, moving OPEN to HALF_OPEN once the recovery timeout has elapsed.
     */
    public State currentState() {
        if (state.get() == State.OPEN && openedAt != null
                && !clock.instant().isBefore(openedAt.plus(recoveryTimeout))
                && state.compareAndSet(State.OPEN, State.HALF_OPEN)) {
            halfOpenSuccesses.set(0);
            log.info("Circuit half-open: backend={}", backend);
        }
        return state.get();
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    public String getBackend() {
        return backend;
    }

    @Override
    public String toString() {
        return "CircuitBreaker{backend='" + backend + "', state=" + state.get()
                + ", failures=" + consecutiveFailures.get() + '}';
    }
}
