package fr.lapetina.llmrouter.infrastructure.resilience;

import fr.lapetina.llmrouter.domain.model.CircuitState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Circuit breaker protecting a single provider.
 *
 * States:
 * - CLOSED: calls pass; {@code failureThreshold} consecutive failures open the circuit
 * - OPEN: calls rejected until {@code openTimeout} has elapsed since opening
 * - HALF_OPEN: at most {@code halfOpenMaxCalls} concurrent trial calls; any failure reopens,
 *   {@code successThreshold} consecutive successes close
 *
 * The OPEN to HALF_OPEN move happens lazily on the next eligibility check; no timer is involved.
 *
 * Thread-safety: state is read lock-free, so the CLOSED path never synchronizes. Transitions and
 * counter updates run in a short critical section on this breaker only. Half-open admission is
 * tracked by an in-flight counter, released when the trial call reports its outcome.
 *
 * Every transition starts a new epoch. Permits carry the epoch they were issued in, and outcomes
 * reported with a permit from an earlier epoch are ignored.
 */
public final class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final int DEFAULT_SUCCESS_THRESHOLD = 3;
    public static final Duration DEFAULT_OPEN_TIMEOUT = Duration.ofSeconds(60);
    public static final int DEFAULT_HALF_OPEN_MAX_CALLS = 3;

    /**
     * Admission ticket returned for a permitted call; hand it back with the outcome.
     *
     * @param trial true if the call was admitted as a half-open trial
     * @param epoch state epoch the call was admitted in
     */
    public record Permit(boolean trial, long epoch) {
    }

    private final String providerId;
    private final int failureThreshold;
    private final int successThreshold;
    private final Duration openTimeout;
    private final int halfOpenMaxCalls;
    private final Clock clock;

    private final Object transitionLock = new Object();
    private final AtomicReference<CircuitState> state = new AtomicReference<>(CircuitState.CLOSED);
    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    private final AtomicInteger consecutiveSuccesses = new AtomicInteger(0);
    private final AtomicInteger halfOpenInFlight = new AtomicInteger(0);
    private volatile Instant openedAt;
    private volatile long epoch;

    public CircuitBreaker(
            String providerId,
            int failureThreshold,
            int successThreshold,
            Duration openTimeout,
            int halfOpenMaxCalls,
            Clock clock
    ) {
        this.providerId = Objects.requireNonNull(providerId, "Provider ID is required");
        if (failureThreshold < 1 || successThreshold < 1 || halfOpenMaxCalls < 1) {
            throw new IllegalArgumentException("Circuit breaker thresholds must be >= 1");
        }
        if (openTimeout == null || openTimeout.isNegative()) {
            throw new IllegalArgumentException("Open timeout must be >= 0");
        }
        this.failureThreshold = failureThreshold;
        this.successThreshold = successThreshold;
        this.openTimeout = openTimeout;
        this.halfOpenMaxCalls = halfOpenMaxCalls;
        this.clock = Objects.requireNonNull(clock, "Clock is required");
    }

    public CircuitBreaker(String providerId) {
        this(providerId, DEFAULT_FAILURE_THRESHOLD, DEFAULT_SUCCESS_THRESHOLD,
                DEFAULT_OPEN_TIMEOUT, DEFAULT_HALF_OPEN_MAX_CALLS, Clock.systemUTC());
    }

    /**
     * Eligibility check used when building routing snapshots. Does not admit a call.
     *
     * @return true if CLOSED, or HALF_OPEN with trial budget left
     */
    public boolean isCallPermitted() {
        if (state.get() == CircuitState.CLOSED) {
            return true;
        }
        synchronized (transitionLock) {
            CircuitState current = refreshState();
            return current == CircuitState.CLOSED
                    || (current == CircuitState.HALF_OPEN && halfOpenInFlight.get() < halfOpenMaxCalls);
        }
    }

    /**
     * Admits one call if the breaker allows it.
     *
     * @return a permit to report back with the outcome, or empty if the call must not be made
     */
    public Optional<Permit> tryAcquirePermission() {
        // Epoch before state: a transition in between leaves the permit stale, never ahead
        long admittedEpoch = epoch;
        if (state.get() == CircuitState.CLOSED) {
            return Optional.of(new Permit(false, admittedEpoch));
        }
        synchronized (transitionLock) {
            CircuitState current = refreshState();
            if (current == CircuitState.CLOSED) {
                return Optional.of(new Permit(false, epoch));
            }
            if (current == CircuitState.HALF_OPEN && halfOpenInFlight.get() < halfOpenMaxCalls) {
                int inFlight = halfOpenInFlight.incrementAndGet();
                log.debug("Half-open trial admitted: providerId={}, inFlight={}/{}",
                        providerId, inFlight, halfOpenMaxCalls);
                return Optional.of(new Permit(true, epoch));
            }
            return Optional.empty();
        }
    }

    /**
     * Records a successful call admitted with the given permit.
     */
    public void recordSuccess(Permit permit) {
        synchronized (transitionLock) {
            if (isStale(permit)) {
                log.debug("Ignoring success from an earlier epoch: providerId={}, state={}", providerId, state.get());
                return;
            }
            releaseTrial(permit);
            switch (state.get()) {
                case CLOSED:
                    consecutiveFailures.set(0);
                    break;
                case HALF_OPEN:
                    int successes = consecutiveSuccesses.incrementAndGet();
                    if (successes >= successThreshold) {
                        transitionToClosed();
                    }
                    break;
                default:
                    break;
            }
        }
    }

    /**
     * Records a failed call admitted with the given permit.
     */
    public void recordFailure(Permit permit) {
        synchronized (transitionLock) {
            if (isStale(permit)) {
                log.debug("Ignoring failure from an earlier epoch: providerId={}, state={}", providerId, state.get());
                return;
            }
            releaseTrial(permit);
            switch (state.get()) {
                case CLOSED:
                    int failures = consecutiveFailures.incrementAndGet();
                    if (failures >= failureThreshold) {
                        transitionToOpen("failures=" + failures);
                    }
                    break;
                case HALF_OPEN:
                    transitionToOpen("half-open trial failed");
                    break;
                default:
                    break;
            }
        }
    }

    /**
     * Records a success against the current epoch, without a permit.
     */
    public void recordSuccess() {
        synchronized (transitionLock) {
            recordSuccess(new Permit(false, epoch));
        }
    }

    /**
     * Records a failure against the current epoch, without a permit.
     */
    public void recordFailure() {
        synchronized (transitionLock) {
            recordFailure(new Permit(false, epoch));
        }
    }

    /**
     * Forces the circuit to a specific state. For operator resets and tests.
     */
    public void forceState(CircuitState newState) {
        synchronized (transitionLock) {
            CircuitState old = state.get();
            switch (newState) {
                case CLOSED -> transitionToClosed();
                case OPEN -> transitionToOpen("forced");
                case HALF_OPEN -> transitionToHalfOpen();
            }
            log.info("Circuit breaker forced from {} to {}: providerId={}", old, newState, providerId);
        }
    }

    /**
     * Current state, applying the lazy OPEN to HALF_OPEN transition if its timeout has elapsed.
     */
    public CircuitState getState() {
        if (state.get() != CircuitState.OPEN) {
            return state.get();
        }
        synchronized (transitionLock) {
            return refreshState();
        }
    }

    // Must hold transitionLock
    private CircuitState refreshState() {
        CircuitState current = state.get();
        if (current == CircuitState.OPEN && openedAt != null
                && !clock.instant().isBefore(openedAt.plus(openTimeout))) {
            transitionToHalfOpen();
            return CircuitState.HALF_OPEN;
        }
        return current;
    }

    // Must hold transitionLock
    private boolean isStale(Permit permit) {
        return permit == null || permit.epoch() != epoch;
    }

    private void releaseTrial(Permit permit) {
        if (permit.trial() && state.get() == CircuitState.HALF_OPEN) {
            halfOpenInFlight.decrementAndGet();
        }
    }

    private void transitionToOpen(String reason) {
        epoch++;
        state.set(CircuitState.OPEN);
        openedAt = clock.instant();
        consecutiveFailures.set(0);
        consecutiveSuccesses.set(0);
        halfOpenInFlight.set(0);
        log.warn("Circuit breaker OPENED: providerId={}, reason={}, retryAfterMs={}",
                providerId, reason, openTimeout.toMillis());
    }

    private void transitionToHalfOpen() {
        epoch++;
        consecutiveSuccesses.set(0);
        halfOpenInFlight.set(0);
        state.set(CircuitState.HALF_OPEN);
        log.info("Circuit breaker transitioning to HALF_OPEN: providerId={}, trialCalls={}",
                providerId, halfOpenMaxCalls);
    }

    private void transitionToClosed() {
        epoch++;
        state.set(CircuitState.CLOSED);
        consecutiveFailures.set(0);
        consecutiveSuccesses.set(0);
        halfOpenInFlight.set(0);
        log.info("Circuit breaker CLOSED: providerId={}", providerId);
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    public int getConsecutiveSuccesses() {
        return consecutiveSuccesses.get();
    }

    public int getHalfOpenInFlight() {
        return halfOpenInFlight.get();
    }

    public Instant getOpenedAt() {
        return openedAt;
    }

    public String getProviderId() {
        return providerId;
    }

    @Override
    public String toString() {
        return "CircuitBreaker{" +
                "providerId='" + providerId + '\'' +
                ", state=" + state.get() +
                ", failures=" + consecutiveFailures.get() +
                ", successes=" + consecutiveSuccesses.get() +
                '}';
    }
}
