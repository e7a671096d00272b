package fr.lapetina.embedding.accelerator.pipeline;

import fr.lapetina.embedding.accelerator.domain.exception.BackendUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Circuit breaker guarding calls to an embedding backend.
 *
 * States:
 * - CLOSED: Normal operation, calls pass through
 * - OPEN: Failures exceeded threshold, calls rejected immediately
 * - HALF_OPEN: After recovery timeout, trial calls pass through
 *
 * Thread-safe via atomic operations.
 */
public final class BackendCircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(BackendCircuitBreaker.class);

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final String backendName;
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final int successThresholdInHalfOpen;
    private final Clock clock;

    private final AtomicReference<State> state = new AtomicReference<>(State.CLOSED);
    private final AtomicInteger failureCount = new AtomicInteger(0);
    private final AtomicInteger successCountInHalfOpen = new AtomicInteger(0);
    private volatile Instant lastFailureTime;
    private volatile Instant openedAt;

    public BackendCircuitBreaker(
            String backendName,
            int failureThreshold,
            Duration recoveryTimeout,
            int successThresholdInHalfOpen,
            Clock clock
    ) {
        if (failureThreshold <= 0 || successThresholdInHalfOpen <= 0) {
            throw new IllegalArgumentException("Circuit breaker thresholds must be positive");
        }
        this.backendName = backendName;
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = recoveryTimeout;
        this.successThresholdInHalfOpen = successThresholdInHalfOpen;
        this.clock = clock;
    }

    public BackendCircuitBreaker(String backendName, int failureThreshold, Duration recoveryTimeout) {
        this(backendName, failureThreshold, recoveryTimeout, 1, Clock.systemUTC());
    }

    public BackendCircuitBreaker(String backendName) {
        this(backendName, 5, Duration.ofSeconds(30));
    }

    /**
     * Runs a backend call through the breaker.
     *
     * @throws BackendUnavailableException if the circuit is open or the call fails
     * @throws InterruptedException        if the call was interrupted; not counted as a failure
     */
    public <V> V execute(Callable<V> call) throws InterruptedException {
        if (!allowRequest()) {
            throw new BackendUnavailableException(backendName,
                    "Circuit open after " + failureCount.get() + " consecutive failures");
        }
        V result;
        try {
            result = call.call();
        } catch (InterruptedException e) {
            throw e;
        } catch (BackendUnavailableException e) {
            recordFailure();
            throw e;
        } catch (Exception e) {
            recordFailure();
            throw new BackendUnavailableException(backendName, String.valueOf(e.getMessage()), e);
        }
        recordSuccess();
        return result;
    }

    /**
     * Checks if a call is allowed through the circuit breaker.
     *
     * @return true if the call should proceed, false if circuit is open
     */
    public boolean allowRequest() {
        State currentState = state.get();

        switch (currentState) {
            case CLOSED:
                return true;

            case OPEN:
                if (recoveryElapsed()) {
                    if (state.compareAndSet(State.OPEN, State.HALF_OPEN)) {
                        successCountInHalfOpen.set(0);
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

    private boolean recoveryElapsed() {
        Instant opened = openedAt;
        return opened != null && !clock.instant().isBefore(opened.plus(recoveryTimeout));
    }

    /**
     * Records a successful call.
     */
    public void recordSuccess() {
        State currentState = state.get();

        if (currentState == State.CLOSED) {
            failureCount.set(0);
            return;
        }

        if (currentState == State.HALF_OPEN) {
            int successes = successCountInHalfOpen.incrementAndGet();
            if (successes >= successThresholdInHalfOpen) {
                if (state.compareAndSet(State.HALF_OPEN, State.CLOSED)) {
                    failureCount.set(0);
                    log.info("Circuit breaker CLOSED after recovery: backend={}", backendName);
                }
            }
        }
    }

    /**
     * Records a failed call.
     */
    public void recordFailure() {
        lastFailureTime = clock.instant();
        State currentState = state.get();

        if (currentState == State.HALF_OPEN) {
            // Any failure in half-open immediately reopens the circuit
            if (state.compareAndSet(State.HALF_OPEN, State.OPEN)) {
                openedAt = clock.instant();
                log.warn("Circuit breaker OPENED (half-open failure): backend={}", backendName);
            }
            return;
        }

        if (currentState == State.CLOSED) {
            int failures = failureCount.incrementAndGet();
            if (failures >= failureThreshold) {
                if (state.compareAndSet(State.CLOSED, State.OPEN)) {
                    openedAt = clock.instant();
                    log.warn("Circuit breaker OPENED: backend={}, failures={}", backendName, failures);
                }
            }
        }
    }

    /**
     * Forces the circuit to a specific state. For testing/admin use.
     */
    public void forceState(State newState) {
        State old = state.getAndSet(newState);
        if (newState == State.CLOSED) {
            failureCount.set(0);
        }
        if (newState == State.OPEN) {
            openedAt = clock.instant();
        }
        log.info("Circuit breaker forced from {} to {}: backend={}", old, newState, backendName);
    }

    public State getState() {
        if (state.get() == State.OPEN && recoveryElapsed()) {
            if (state.compareAndSet(State.OPEN, State.HALF_OPEN)) {
                successCountInHalfOpen.set(0);
            }
        }
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
        return "BackendCircuitBreaker{" +
                "backend='" + backendName + '\'' +
                ", state=" + state.get() +
                ", failures=" + failureCount.get() +
                '}';
    }
}
