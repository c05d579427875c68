package com.modelrouter.service;

import com.modelrouter.config.RouterProperties;
import com.modelrouter.exception.AllBackendsUnavailableException;
import com.modelrouter.exception.ErrorKind;
import com.modelrouter.exception.InvalidRequestException;
import com.modelrouter.exception.InvalidTierException;
import com.modelrouter.model.dto.GenerationRequest;
import com.modelrouter.model.dto.GenerationResult;
import com.modelrouter.model.routing.BackendClass;
import com.modelrouter.model.routing.ComplexityScore;
import com.modelrouter.model.routing.DispatchResult;
import com.modelrouter.model.routing.RoutingRequest;
import com.modelrouter.model.routing.Tier;
import com.modelrouter.model.routing.UsageRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Single entry point for generation requests: validate, classify, resolve the tier policy,
 * dispatch, meter. The returned {@link Mono} always completes with a result; failures are
 * reported as error results, never as error signals.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RequestGateway {

    private final ComplexityClassifier classifier;
    private final TierPolicyResolver tierPolicyResolver;
    private final Dispatcher dispatcher;
    private final UsageMeteringService usageMeteringService;
    private final ResponseTextCleaner responseTextCleaner;
    private final RouterProperties properties;
    private final Clock routerClock;

    public Mono<GenerationResult> handle(GenerationRequest input) {
        return Mono.defer(() -> route(input));
    }

    /**
     * Runs the requests concurrently and returns one result per request, in input order.
     *
     * @throws InvalidRequestException when the batch is empty or larger than the configured maximum
     */
    public Mono<List<GenerationResult>> handleBatch(List<GenerationRequest> inputs) {
        int maxSize = properties.getBatch().getMaxSize();
        if (inputs == null || inputs.isEmpty()) {
            return Mono.error(new InvalidRequestException("Batch must contain at least one request"));
        }
        if (inputs.size() > maxSize) {
            return Mono.error(new InvalidRequestException(
                    "Batch size limited to " + maxSize + " requests, got " + inputs.size()));
        }
        return Flux.range(0, inputs.size())
                .flatMapSequential(i -> handle(inputs.get(i)))
                .collectList();
    }

    private Mono<GenerationResult> route(GenerationRequest input) {
        long start = System.nanoTime();
        if (input == null) {
            return Mono.just(GenerationResult.error(ErrorKind.INVALID_REQUEST, "Request body is required"));
        }

        Tier tier;
        try {
            tier = Tier.parse(input.getCustomerTier());
        } catch (InvalidTierException e) {
            log.warn("Rejected request with unknown tier '{}'", input.getCustomerTier());
            return Mono.just(GenerationResult.error(ErrorKind.INVALID_TIER, e.getMessage()));
        }
        if (input.getPrompt() == null || input.getPrompt().isBlank()) {
            return Mono.just(GenerationResult.error(ErrorKind.INVALID_REQUEST, "Prompt is required"));
        }
        if (input.getPrompt().length() > GenerationRequest.MAX_PROMPT_LENGTH) {
            return Mono.just(GenerationResult.error(ErrorKind.INVALID_REQUEST,
                    "Prompt too long, limit is " + GenerationRequest.MAX_PROMPT_LENGTH + " characters"));
        }

        RoutingRequest request = RoutingRequest.builder()
                .id(UUID.randomUUID().toString())
                .prompt(input.getPrompt())
                .tier(tier)
                .arrivedAt(routerClock.instant())
                .complexityHint(input.getComplexityHint())
                .build();

        ComplexityScore score = classifier.score(request);
        List<BackendClass> preferences = tierPolicyResolver.resolve(tier, score);
        log.debug("Request {} tier={} score={} breakdown={} -> {}",
                request.getId(), tier.getCode(), score.getValue(), score.getBreakdown(), preferences);

        return dispatcher.dispatch(request, preferences)
                .map(result -> succeeded(request, result, elapsedMs(start)))
                .onErrorResume(AllBackendsUnavailableException.class, e -> {
                    log.error("Request {} failed: {}", request.getId(), e.getMessage());
                    usageMeteringService.record(request, e.toDecision(), elapsedMs(start), false);
                    return Mono.just(GenerationResult.error(e.getKind(), e.getMessage()));
                })
                .onErrorResume(e -> !(e instanceof AllBackendsUnavailableException), e -> {
                    log.error("Request {} failed unexpectedly", request.getId(), e);
                    usageMeteringService.record(request, null, elapsedMs(start), false);
                    return Mono.just(GenerationResult.error(ErrorKind.INTERNAL_ERROR, "Internal routing error"));
                });
    }

    private GenerationResult succeeded(RoutingRequest request, DispatchResult result, long latencyMs) {
        UsageRecord record = usageMeteringService.record(request, result.getDecision(), latencyMs, true);
        log.info("Request {} served by {} in {}ms after {} attempt(s), margin {}",
                request.getId(), result.getBackend().getId(), latencyMs,
                result.getDecision().getAttemptCount(), record.getMargin());
        return GenerationResult.success(
                responseTextCleaner.clean(result.getText()),
                result.getBackend().getId(),
                latencyMs,
                record.getCost());
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
