package com.modelrouter.service.health;

import com.modelrouter.model.routing.HealthState;
import lombok.Getter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Per-backend circuit breaker.
 *
 * <pre>
 *   CLOSED    --(probe failure | N consecutive call failures)--> OPEN
 *   OPEN      --(cool-down elapsed)---------------------------> HALF_OPEN
 *   HALF_OPEN --(trial succeeds)------------------------------> CLOSED
 *   HALF_OPEN --(trial fails)---------------------------------> OPEN, cool-down * multiplier (capped)
 * </pre>
 *
 * In HALF_OPEN exactly one trial is let through until it reports back. Every transition
 * method returns the state after the transition.
 */
public class CircuitBreaker {

    @Getter
    private final String backendId;
    private final int failureThreshold;
    private final Duration baseCoolDown;
    private final Duration maxCoolDown;
    private final double backoffMultiplier;
    private final Clock clock;

    private HealthState state = HealthState.CLOSED;
    private int consecutiveFailures;
    private Duration coolDown;
    private Instant openedAt;
    private boolean trialInFlight;

    public CircuitBreaker(String backendId, int failureThreshold, Duration coolDown,
                          Duration maxCoolDown, double backoffMultiplier, Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be at least 1");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be at least 1.0");
        }
        this.backendId = backendId;
        this.failureThreshold = failureThreshold;
        this.baseCoolDown = coolDown;
        this.maxCoolDown = maxCoolDown.compareTo(coolDown) < 0 ? coolDown : maxCoolDown;
        this.backoffMultiplier = backoffMultiplier;
        this.clock = clock;
        this.coolDown = coolDown;
    }

    /** Current state, moving OPEN to HALF_OPEN once the cool-down has elapsed. */
    public synchronized HealthState currentState() {
        if (state == HealthState.OPEN && !clock.instant().isBefore(openedAt.plus(coolDown))) {
            state = HealthState.HALF_OPEN;
            trialInFlight = false;
        }
        return state;
    }

    /**
     * Asks to make one call. Always granted when closed, never when open, and granted to a
     * single caller at a time when half-open.
     */
    public synchronized boolean tryAcquirePermission() {
        switch (currentState()) {
            case CLOSED:
                return true;
            case HALF_OPEN:
                if (trialInFlight) {
                    return false;
                }
                trialInFlight = true;
                return true;
            default:
                return false;
        }
    }

    /** Gives back a half-open trial permit whose call was cancelled before it reported. */
    public synchronized void releasePermission() {
        if (state == HealthState.HALF_OPEN) {
            trialInFlight = false;
        }
    }

    public synchronized HealthState onCallSuccess() {
        if (currentState() == HealthState.HALF_OPEN) {
            close();
        } else if (state == HealthState.CLOSED) {
            consecutiveFailures = 0;
        }
        return state;
    }

    public synchronized HealthState onCallFailure() {
        switch (currentState()) {
            case CLOSED:
                consecutiveFailures++;
                if (consecutiveFailures >= failureThreshold) {
                    open(baseCoolDown);
                }
                break;
            case HALF_OPEN:
                consecutiveFailures++;
                open(nextCoolDown());
                break;
            default:
                // a late result from a call issued before the breaker opened
                break;
        }
        return state;
    }

    /** A passing probe closes a half-open breaker but leaves the dispatch failure count alone. */
    public synchronized HealthState onProbeSuccess() {
        if (currentState() == HealthState.HALF_OPEN) {
            close();
        }
        return state;
    }

    public synchronized HealthState onProbeFailure() {
        switch (currentState()) {
            case CLOSED:
                open(baseCoolDown);
                break;
            case HALF_OPEN:
                open(nextCoolDown());
                break;
            default:
                break;
        }
        return state;
    }

    public synchronized int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public synchronized Duration getCoolDown() {
        return coolDown;
    }

    private void open(Duration nextCoolDown) {
        state = HealthState.OPEN;
        coolDown = nextCoolDown;
        openedAt = clock.instant();
        trialInFlight = false;
    }

    private void close() {
        state = HealthState.CLOSED;
        consecutiveFailures = 0;
        coolDown = baseCoolDown;
        trialInFlight = false;
    }

    private Duration nextCoolDown() {
        long next = (long) (coolDown.toMillis() * backoffMultiplier);
        return next >= maxCoolDown.toMillis() ? maxCoolDown : Duration.ofMillis(next);
    }
}
