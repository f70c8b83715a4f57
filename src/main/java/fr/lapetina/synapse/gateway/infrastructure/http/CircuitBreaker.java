package fr.lapetina.synapse.gateway.infrastructure.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Failure-counting circuit breaker guarding one backend.
 *
 * States:
 * - CLOSED: Normal operation, requests pass through
 * - OPEN: Failures reached threshold, requests rejected without any network call
 * - HALF_OPEN: Cooldown elapsed since the last failure, probes are let through
 *
 * Any success closes the circuit and clears the failure count, whatever the state.
 * Probes in HALF_OPEN are not serialized: concurrent callers may all pass.
 *
 * Thread-safe via atomic operations.
 */
public final class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final String backendName;
    private final int failureThreshold;
    private final Duration cooldown;

    private final AtomicReference<State> state = new AtomicReference<>(State.CLOSED);
    private final AtomicInteger failureCount = new AtomicInteger(0);
    private volatile Instant lastFailureTime;

    public CircuitBreaker(String backendName, int failureThreshold, Duration cooldown) {
        this.backendName = backendName;
        this.failureThreshold = failureThreshold;
        this.cooldown = cooldown;
    }

    public CircuitBreaker(String backendName) {
        this(backendName, 5, Duration.ofSeconds(30));
    }

    /**
     * Checks if a request attempt is allowed through the circuit breaker.
     * An OPEN circuit whose cooldown has elapsed moves to HALF_OPEN as a side effect.
     *
     * @return true if the attempt should proceed, false if the circuit is open
     */
    public boolean allowRequest() {
        State currentState = state.get();

        switch (currentState) {
            case CLOSED:
                return true;

            case OPEN:
                if (cooldownElapsed()) {
                    if (state.compareAndSet(State.OPEN, State.HALF_OPEN)) {
                        log.info("Circuit breaker transitioning to HALF_OPEN: backend={}", backendName);
                    }
                    return true;
                }
                return false;

            case HALF_OPEN:
                return true;

            default:
                return true;
        }
    }

    /**
     * Records a successful attempt. Resets the counter and closes the circuit.
     */
    public void recordSuccess() {
        failureCount.set(0);
        State previous = state.getAndSet(State.CLOSED);
        if (previous != State.CLOSED) {
            log.info("Circuit breaker CLOSED after recovery: backend={}, previousState={}", backendName, previous);
        }
    }

    /**
     * Records a failed attempt. Opens the circuit once the threshold is reached.
     */
    public void recordFailure() {
        lastFailureTime = Instant.now();
        int failures = failureCount.incrementAndGet();

        if (failures >= failureThreshold) {
            State previous = state.getAndSet(State.OPEN);
            if (previous != State.OPEN) {
                log.warn("Circuit breaker OPENED: backend={}, failures={}", backendName, failures);
            }
        }
    }

    private boolean cooldownElapsed() {
        Instant last = lastFailureTime;
        return last == null || Instant.now().isAfter(last.plus(cooldown));
    }

    public State getState() {
        return state.get();
    }

    public int getFailureCount() {
        return failureCount.get();
    }

    public Instant getLastFailureTime() {
        return lastFailureTime;
    }

    public String getBackendName() {
        return backendName;
    }

    @Override
    public String toString() {
        return "CircuitBreaker{" +
                "backend='" + backendName + '\'' +
                ", state=" + state.get() +
                ", failures=" + failureCount.get() +
                '}';
    }
}
