package com.modelrouter.service;

import com.modelrouter.client.BackendClient;
import com.modelrouter.config.RouterProperties;
import com.modelrouter.exception.AllBackendsUnavailableException;
import com.modelrouter.exception.BackendRejectedException;
import com.modelrouter.exception.BackendTimeoutException;
import com.modelrouter.model.routing.AttemptOutcome;
import com.modelrouter.model.routing.BackendClass;
import com.modelrouter.model.routing.DispatchAttempt;
import com.modelrouter.model.routing.DispatchResult;
import com.modelrouter.model.routing.ModelBackend;
import com.modelrouter.model.routing.RoutingDecision;
import com.modelrouter.model.routing.RoutingRequest;
import com.modelrouter.service.health.HealthMonitor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Calls backends along a preference list until one answers.
 * <p>
 * For each class in order, the registry's non-open backends are tried in configuration
 * order; a class without any is recorded as an unavailable attempt and skipped. Every call
 * is bounded by the dispatch timeout, and every failure is reported to the
 * {@link HealthMonitor} before moving on. When the list or the call budget runs out the
 * result is an {@link AllBackendsUnavailableException}.
 * <p>
 * Cancelling the returned {@link Mono} cancels the in-flight call without charging a
 * failure to the backend.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class Dispatcher {

    private final BackendRegistry registry;
    private final HealthMonitor healthMonitor;
    private final BackendClient backendClient;
    private final RouterProperties properties;

    public Mono<DispatchResult> dispatch(RoutingRequest request, List<BackendClass> preferences) {
        if (preferences == null || preferences.isEmpty()) {
            return Mono.error(new IllegalArgumentException("Preference list must not be empty"));
        }
        return Mono.defer(() -> tryClass(new Attempts(request, preferences), 0));
    }

    private Mono<DispatchResult> tryClass(Attempts attempts, int classIndex) {
        if (classIndex >= attempts.preferences.size()) {
            return Mono.error(attempts.exhausted());
        }
        BackendClass backendClass = attempts.preferences.get(classIndex);
        List<ModelBackend> candidates = registry.get(backendClass).stream()
                .filter(ModelBackend::isAvailable)
                .toList();
        if (candidates.isEmpty()) {
            attempts.add(backendClass, null, AttemptOutcome.UNAVAILABLE, 0,
                    "no " + backendClass.getCode() + " backend available");
            return tryClass(attempts, classIndex + 1);
        }
        return tryCandidate(attempts, classIndex, candidates, 0);
    }

    private Mono<DispatchResult> tryCandidate(Attempts attempts, int classIndex,
                                              List<ModelBackend> candidates, int candidateIndex) {
        if (candidateIndex >= candidates.size()) {
            return tryClass(attempts, classIndex + 1);
        }
        if (attempts.calls >= properties.getDispatch().getMaxAttempts()) {
            log.warn("Request {} reached the limit of {} backend calls",
                    attempts.request.getId(), properties.getDispatch().getMaxAttempts());
            return Mono.error(attempts.exhausted());
        }

        ModelBackend backend = candidates.get(candidateIndex);
        if (!healthMonitor.tryAcquire(backend.getId())) {
            attempts.add(backend.getBackendClass(), backend.getId(), AttemptOutcome.UNAVAILABLE, 0,
                    "circuit breaker refused the call");
            return tryCandidate(attempts, classIndex, candidates, candidateIndex + 1);
        }

        attempts.calls++;
        Duration timeout = properties.getDispatch().getTimeout();
        long start = System.nanoTime();

        return backendClient.generate(backend, attempts.request.getPrompt())
                .timeout(timeout)
                .onErrorMap(TimeoutException.class, e -> new BackendTimeoutException(backend.getId(), timeout))
                .switchIfEmpty(Mono.error(() -> new BackendRejectedException(backend.getId(), 0, "empty response")))
                .doOnCancel(() -> healthMonitor.release(backend.getId()))
                .map(text -> {
                    healthMonitor.recordSuccess(backend.getId());
                    attempts.add(backend.getBackendClass(), backend.getId(), AttemptOutcome.SUCCESS, elapsedMs(start), null);
                    return new DispatchResult(attempts.decision(backend), backend, text);
                })
                .onErrorResume(error -> {
                    AttemptOutcome outcome = error instanceof BackendTimeoutException
                            ? AttemptOutcome.TIMEOUT : AttemptOutcome.REJECTED;
                    healthMonitor.recordFailure(backend.getId(), error);
                    attempts.add(backend.getBackendClass(), backend.getId(), outcome, elapsedMs(start), error.getMessage());
                    log.warn("Request {} attempt {} on {} failed ({}): {}", attempts.request.getId(),
                            attempts.size(), backend.getId(), outcome.getCode(), error.getMessage());
                    return tryCandidate(attempts, classIndex, candidates, candidateIndex + 1);
                });
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    /** Attempt log for one request. Only touched from that request's sequential chain. */
    private static final class Attempts {
        private final RoutingRequest request;
        private final List<BackendClass> preferences;
        private final List<DispatchAttempt> entries = new ArrayList<>();
        private int calls;

        private Attempts(RoutingRequest request, List<BackendClass> preferences) {
            this.request = request;
            this.preferences = List.copyOf(preferences);
        }

        void add(BackendClass backendClass, String backendId, AttemptOutcome outcome, long latencyMs, String detail) {
            entries.add(new DispatchAttempt(entries.size() + 1, backendClass, backendId, outcome, latencyMs, detail));
        }

        int size() {
            return entries.size();
        }

        RoutingDecision decision(ModelBackend served) {
            String rationale = entries.size() == 1
                    ? "served by first choice (" + served.getBackendClass().getCode() + ")"
                    : "fallback to " + served.getBackendClass().getCode() + " after " + (entries.size() - 1) + " unsuccessful attempt(s)";
            return new RoutingDecision(served.getId(), served.getBackendClass(), entries, rationale);
        }

        AllBackendsUnavailableException exhausted() {
            return new AllBackendsUnavailableException(entries);
        }
    }
}
