package com.modelrouter.service.health;

import com.modelrouter.config.RouterProperties;
import com.modelrouter.model.routing.HealthState;
import com.modelrouter.service.BackendRegistry;
import com.modelrouter.support.MutableClock;
import com.modelrouter.support.RouterFixtures;
import com.modelrouter.support.StubBackendClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.modelrouter.support.RouterFixtures.HEAVY_1;
import static com.modelrouter.support.RouterFixtures.LIGHT_1;
import static com.modelrouter.support.RouterFixtures.LIGHT_2;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HealthMonitorTest {

    private RouterProperties properties;
    private BackendRegistry registry;
    private StubBackendClient client;
    private MutableClock clock;
    private HealthMonitor monitor;

    @BeforeEach
    void setUp() {
        properties = RouterFixtures.properties();
        properties.getHealth().setProbeTimeout(Duration.ofMillis(200));
        registry = new BackendRegistry(properties.toModelBackends());
        client = new StubBackendClient();
        clock = new MutableClock();
        monitor = new HealthMonitor(registry, client, properties, clock);
    }

    private HealthState registryState(String id) {
        return registry.find(id).orElseThrow().getHealth();
    }

    @Test
    void dispatchFailuresOpenTheBackendInTheRegistry() {
        for (int i = 0; i < 3; i++) {
            monitor.recordFailure(HEAVY_1, new RuntimeException("boom"));
        }

        assertThat(registryState(HEAVY_1)).isEqualTo(HealthState.OPEN);
        assertThat(registryState(LIGHT_1)).isEqualTo(HealthState.CLOSED);
        assertThat(monitor.tryAcquire(HEAVY_1)).isFalse();
    }

    @Test
    void failingProbeOpensBackendAndOpenBackendsAreNotProbed() {
        client.probeFails(LIGHT_2);

        monitor.checkAll();

        assertThat(registryState(LIGHT_2)).isEqualTo(HealthState.OPEN);
        assertThat(registryState(LIGHT_1)).isEqualTo(HealthState.CLOSED);
        assertThat(client.probeCalls()).containsExactlyInAnyOrder(LIGHT_1, LIGHT_2, HEAVY_1);

        monitor.checkAll();

        assertThat(client.probeCalls()).filteredOn(LIGHT_2::equals).hasSize(1);
    }

    @Test
    void hangingProbeCountsAsFailure() {
        client.probeHangs(HEAVY_1);
        monitor.checkAll();
        assertThat(registryState(HEAVY_1)).isEqualTo(HealthState.OPEN);
    }

    @Test
    void probeAfterCoolDownRecoversBackend() {
        client.probeFails(HEAVY_1);
        monitor.checkAll();

        client.probePasses(HEAVY_1);
        clock.advance(Duration.ofSeconds(30));
        monitor.checkAll();

        assertThat(registryState(HEAVY_1)).isEqualTo(HealthState.CLOSED);
    }

    @Test
    void timersAdvanceEvenWithProbingDisabled() {
        properties.getHealth().setEnabled(false);
        monitor = new HealthMonitor(registry, client, properties, clock);
        for (int i = 0; i < 3; i++) {
            monitor.recordFailure(HEAVY_1, new RuntimeException("boom"));
        }

        clock.advance(Duration.ofSeconds(30));
        monitor.checkAll();

        assertThat(registryState(HEAVY_1)).isEqualTo(HealthState.HALF_OPEN);
        assertThat(client.probeCalls()).isEmpty();
    }

    @Test
    void successfulHalfOpenTrialClosesBackend() {
        for (int i = 0; i < 3; i++) {
            monitor.recordFailure(HEAVY_1, new RuntimeException("boom"));
        }
        clock.advance(Duration.ofSeconds(30));

        assertThat(monitor.tryAcquire(HEAVY_1)).isTrue();
        assertThat(registryState(HEAVY_1)).isEqualTo(HealthState.HALF_OPEN);
        monitor.recordSuccess(HEAVY_1);

        assertThat(registryState(HEAVY_1)).isEqualTo(HealthState.CLOSED);
        assertThat(monitor.consecutiveFailures(HEAVY_1)).isZero();
    }

    @Test
    void registryMatchesBreakerAfterConcurrentOutcomes() throws InterruptedException {
        properties.getHealth().setFailureThreshold(1);
        properties.getHealth().setEnabled(false);
        monitor = new HealthMonitor(registry, client, properties, clock);

        for (int round = 0; round < 50; round++) {
            ExecutorService pool = Executors.newFixedThreadPool(4);
            CountDownLatch start = new CountDownLatch(1);
            for (int t = 0; t < 4; t++) {
                boolean fail = t % 2 == 0;
                pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < 200; i++) {
                        if (fail) {
                            monitor.recordFailure(HEAVY_1, new RuntimeException("boom"));
                        } else {
                            monitor.recordSuccess(HEAVY_1);
                        }
                        clock.advance(Duration.ofSeconds(30));
                        monitor.tryAcquire(HEAVY_1);
                    }
                    return null;
                });
            }
            start.countDown();
            pool.shutdown();
            assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

            assertThat(registryState(HEAVY_1)).isEqualTo(monitor.stateOf(HEAVY_1));
        }
    }

    @Test
    void unknownBackendIsRejected() {
        assertThatThrownBy(() -> monitor.stateOf("nope")).isInstanceOf(IllegalArgumentException.class);
    }
}
