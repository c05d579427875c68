package com.modelrouter.service.health;

import com.modelrouter.client.BackendClient;
import com.modelrouter.config.RouterProperties;
import com.modelrouter.model.routing.HealthState;
import com.modelrouter.model.routing.ModelBackend;
import com.modelrouter.service.BackendRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Owns one {@link CircuitBreaker} per backend and is the only writer of backend health in
 * the {@link BackendRegistry}. Health changes come from two sources: a periodic liveness
 * probe, and call outcomes reported by the dispatcher.
 */
@Service
@Slf4j
public class HealthMonitor implements SchedulingConfigurer {

    private final BackendRegistry registry;
    private final BackendClient backendClient;
    private final RouterProperties.Health settings;
    private final Map<String, CircuitBreaker> breakers;

    public HealthMonitor(BackendRegistry registry, BackendClient backendClient,
                         RouterProperties properties, Clock routerClock) {
        this.registry = registry;
        this.backendClient = backendClient;
        this.settings = properties.getHealth();

        Map<String, CircuitBreaker> map = new LinkedHashMap<>();
        for (ModelBackend backend : registry.all()) {
            map.put(backend.getId(), new CircuitBreaker(backend.getId(),
                    settings.getFailureThreshold(),
                    settings.getCoolDown(),
                    settings.getMaxCoolDown(),
                    settings.getBackoffMultiplier(),
                    routerClock));
        }
        this.breakers = Collections.unmodifiableMap(map);
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar taskRegistrar) {
        taskRegistrar.addFixedDelayTask(this::runScheduledCheck, settings.getProbeInterval());
        log.info("Health checks scheduled every {} (probes {})",
                settings.getProbeInterval(), settings.isEnabled() ? "enabled" : "disabled");
    }

    /**
     * One monitoring round: advances breaker timers, then probes every backend that is not
     * open. Probes run in parallel, each bounded by the probe timeout.
     */
    public void checkAll() {
        List<Mono<Void>> probes = new ArrayList<>();
        for (ModelBackend backend : registry.all()) {
            CircuitBreaker breaker = breaker(backend.getId());
            HealthState state = transition(breaker, CircuitBreaker::currentState);
            if (settings.isEnabled() && state != HealthState.OPEN) {
                probes.add(probe(backend, breaker));
            }
        }
        if (!probes.isEmpty()) {
            Flux.merge(probes).then().block(settings.getProbeTimeout().plus(Duration.ofSeconds(1)));
        }
    }

    /** Called before each dispatch; false means the breaker refuses the call. */
    public boolean tryAcquire(String backendId) {
        CircuitBreaker breaker = breaker(backendId);
        boolean[] permitted = new boolean[1];
        transition(breaker, b -> {
            permitted[0] = b.tryAcquirePermission();
            return b.currentState();
        });
        return permitted[0];
    }

    public void recordSuccess(String backendId) {
        transition(breaker(backendId), CircuitBreaker::onCallSuccess);
    }

    public void recordFailure(String backendId, Throwable cause) {
        CircuitBreaker breaker = breaker(backendId);
        transition(breaker, CircuitBreaker::onCallFailure);
        log.debug("Dispatch failure #{} on {}: {}", breaker.getConsecutiveFailures(), backendId, cause.toString());
    }

    /** The call was cancelled by the caller; no outcome is recorded against the backend. */
    public void release(String backendId) {
        breaker(backendId).releasePermission();
    }

    public HealthState stateOf(String backendId) {
        return breaker(backendId).currentState();
    }

    public int consecutiveFailures(String backendId) {
        return breaker(backendId).getConsecutiveFailures();
    }

    private void runScheduledCheck() {
        try {
            checkAll();
        } catch (RuntimeException e) {
            log.error("Health check round failed", e);
        }
    }

    private Mono<Void> probe(ModelBackend backend, CircuitBreaker breaker) {
        return Mono.defer(() -> {
            if (!breaker.tryAcquirePermission()) {
                // a half-open trial is already in flight
                return Mono.<Void>empty();
            }
            return backendClient.probe(backend)
                    .timeout(settings.getProbeTimeout())
                    .then(Mono.fromRunnable(() -> transition(breaker, CircuitBreaker::onProbeSuccess)))
                    .onErrorResume(e -> {
                        log.warn("Probe failed for backend {}: {}", backend.getId(), e.toString());
                        transition(breaker, CircuitBreaker::onProbeFailure);
                        return Mono.empty();
                    })
                    .then();
        });
    }

    /**
     * Applies a breaker step and writes the resulting state to the registry while holding the
     * breaker's monitor, so registry writes for one backend happen in transition order.
     */
    private HealthState transition(CircuitBreaker breaker, Function<CircuitBreaker, HealthState> step) {
        String backendId = breaker.getBackendId();
        HealthState previous;
        HealthState state;
        synchronized (breaker) {
            state = step.apply(breaker);
            previous = registry.setHealth(backendId, state);
        }
        if (previous != state) {
            if (state == HealthState.OPEN) {
                log.warn("Backend {} circuit {} -> {} (cool-down {})",
                        backendId, previous.getCode(), state.getCode(), breaker.getCoolDown());
            } else {
                log.info("Backend {} circuit {} -> {}", backendId, previous.getCode(), state.getCode());
            }
        }
        return state;
    }

    private CircuitBreaker breaker(String backendId) {
        CircuitBreaker breaker = breakers.get(backendId);
        if (breaker == null) {
            throw new IllegalArgumentException("Unknown backend: " + backendId);
        }
        return breaker;
    }
}
