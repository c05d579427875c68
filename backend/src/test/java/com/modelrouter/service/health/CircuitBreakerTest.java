package com.modelrouter.service.health;

import com.modelrouter.model.routing.HealthState;
import com.modelrouter.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class CircuitBreakerTest {

    private static final Duration COOL_DOWN = Duration.ofSeconds(30);
    private static final Duration MAX_COOL_DOWN = Duration.ofMinutes(2);

    private MutableClock clock;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        breaker = new CircuitBreaker("heavy-1", 3, COOL_DOWN, MAX_COOL_DOWN, 2.0, clock);
    }

    private void openBreaker() {
        breaker.onCallFailure();
        breaker.onCallFailure();
        breaker.onCallFailure();
    }

    @Test
    void opensAfterConsecutiveFailureThreshold() {
        assertThat(breaker.onCallFailure()).isEqualTo(HealthState.CLOSED);
        assertThat(breaker.onCallFailure()).isEqualTo(HealthState.CLOSED);
        assertThat(breaker.onCallFailure()).isEqualTo(HealthState.OPEN);
        assertThat(breaker.tryAcquirePermission()).isFalse();
    }

    @Test
    void successResetsTheFailureCount() {
        breaker.onCallFailure();
        breaker.onCallFailure();
        breaker.onCallSuccess();
        breaker.onCallFailure();

        assertThat(breaker.currentState()).isEqualTo(HealthState.CLOSED);
        assertThat(breaker.getConsecutiveFailures()).isEqualTo(1);
    }

    @Test
    void probeFailureOpensAClosedBreakerImmediately() {
        assertThat(breaker.onProbeFailure()).isEqualTo(HealthState.OPEN);
    }

    @Test
    void becomesHalfOpenOnceCoolDownElapses() {
        openBreaker();

        clock.advance(COOL_DOWN.minusSeconds(1));
        assertThat(breaker.currentState()).isEqualTo(HealthState.OPEN);

        clock.advance(Duration.ofSeconds(1));
        assertThat(breaker.currentState()).isEqualTo(HealthState.HALF_OPEN);
    }

    @Test
    void halfOpenLetsExactlyOneTrialThrough() {
        openBreaker();
        clock.advance(COOL_DOWN);

        assertThat(breaker.tryAcquirePermission()).isTrue();
        assertThat(breaker.tryAcquirePermission()).isFalse();
        assertThat(breaker.tryAcquirePermission()).isFalse();
    }

    @Test
    void successfulTrialClosesAndResetsCoolDown() {
        openBreaker();
        clock.advance(COOL_DOWN);
        breaker.tryAcquirePermission();
        breaker.onCallFailure();
        clock.advance(breaker.getCoolDown());
        breaker.tryAcquirePermission();

        assertThat(breaker.onCallSuccess()).isEqualTo(HealthState.CLOSED);
        assertThat(breaker.getCoolDown()).isEqualTo(COOL_DOWN);
        assertThat(breaker.getConsecutiveFailures()).isZero();
        assertThat(breaker.tryAcquirePermission()).isTrue();
    }

    @Test
    void failedTrialsGrowCoolDownUpToTheCap() {
        openBreaker();

        Duration[] expected = {Duration.ofSeconds(60), Duration.ofSeconds(120), Duration.ofSeconds(120)};
        for (Duration next : expected) {
            clock.advance(breaker.getCoolDown());
            assertThat(breaker.tryAcquirePermission()).isTrue();
            assertThat(breaker.onCallFailure()).isEqualTo(HealthState.OPEN);
            assertThat(breaker.getCoolDown()).isEqualTo(next);
        }
    }

    @Test
    void releasedPermitCanBeTakenAgain() {
        openBreaker();
        clock.advance(COOL_DOWN);
        assertThat(breaker.tryAcquirePermission()).isTrue();

        breaker.releasePermission();

        assertThat(breaker.currentState()).isEqualTo(HealthState.HALF_OPEN);
        assertThat(breaker.tryAcquirePermission()).isTrue();
    }

    @Test
    void passingProbeClosesOnlyAHalfOpenBreaker() {
        breaker.onCallFailure();
        assertThat(breaker.onProbeSuccess()).isEqualTo(HealthState.CLOSED);
        assertThat(breaker.getConsecutiveFailures()).isEqualTo(1);

        breaker.onProbeFailure();
        assertThat(breaker.onProbeSuccess()).isEqualTo(HealthState.OPEN);

        clock.advance(COOL_DOWN);
        assertThat(breaker.onProbeSuccess()).isEqualTo(HealthState.CLOSED);
    }
}
