package com.modelrouter.service;

import com.modelrouter.model.dto.BackendUsageDto;
import com.modelrouter.model.dto.UsageSummaryDto;
import com.modelrouter.model.routing.ModelBackend;
import com.modelrouter.model.routing.RoutingDecision;
import com.modelrouter.model.routing.RoutingRequest;
import com.modelrouter.model.routing.Tier;
import com.modelrouter.model.routing.UsageRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;

/**
 * Turns each completed request into a {@link UsageRecord} and keeps process-wide totals.
 * <p>
 * Totals are lock-free ({@link LongAdder} counters and CAS-accumulated amounts), so
 * concurrent requests can record at the same time. Totals are eventually consistent. Records
 * are flushed to the {@link UsageRecordSink} on a separate scheduler; a failed flush is
 * logged and counted and never reaches the caller.
 */
@Service
@Slf4j
public class UsageMeteringService {

    private final TierPolicyResolver tierPolicyResolver;
    private final BackendRegistry registry;
    private final UsageRecordSink sink;
    private final Clock clock;
    private final Scheduler flushScheduler;

    private final LongAdder totalRequests = new LongAdder();
    private final LongAdder successfulRequests = new LongAdder();
    private final LongAdder failedRequests = new LongAdder();
    private final LongAdder meteringWriteFailures = new LongAdder();
    private final LongAdder negativeMarginRecords = new LongAdder();
    private final AtomicReference<BigDecimal> totalRevenue = new AtomicReference<>(BigDecimal.ZERO);
    private final AtomicReference<BigDecimal> totalCost = new AtomicReference<>(BigDecimal.ZERO);
    private final Map<Tier, LongAdder> requestsByTier;
    private final Map<String, BackendStats> backendStats = new ConcurrentHashMap<>();

    @Autowired
    public UsageMeteringService(TierPolicyResolver tierPolicyResolver, BackendRegistry registry,
                                UsageRecordSink sink, Clock routerClock) {
        this(tierPolicyResolver, registry, sink, routerClock, Schedulers.boundedElastic());
    }

    public UsageMeteringService(TierPolicyResolver tierPolicyResolver, BackendRegistry registry,
                                UsageRecordSink sink, Clock clock, Scheduler flushScheduler) {
        this.tierPolicyResolver = tierPolicyResolver;
        this.registry = registry;
        this.sink = sink;
        this.clock = clock;
        this.flushScheduler = flushScheduler;

        Map<Tier, LongAdder> byTier = new EnumMap<>(Tier.class);
        for (Tier tier : Tier.values()) {
            byTier.put(tier, new LongAdder());
        }
        this.requestsByTier = Collections.unmodifiableMap(byTier);
    }

    /**
     * Records one completed request.
     *
     * @param decision the routing decision; on failure this is the decision built from the
     *                 exhausted attempt list and carries no backend
     */
    public UsageRecord record(RoutingRequest request, RoutingDecision decision, long latencyMs, boolean success) {
        ModelBackend backend = success && decision != null && decision.isServed()
                ? registry.find(decision.getBackendId()).orElse(null)
                : null;
        boolean served = backend != null;

        BigDecimal price = served ? tierPolicyResolver.priceFor(request.getTier()) : BigDecimal.ZERO;
        BigDecimal cost = served ? backend.getCostPerRequest() : BigDecimal.ZERO;
        BigDecimal margin = price.subtract(cost);
        if (margin.signum() < 0) {
            negativeMarginRecords.increment();
            log.warn("Negative margin {} for tier {} on backend {}: check pricing configuration",
                    margin, request.getTier().getCode(), backend.getId());
        }

        UsageRecord record = UsageRecord.builder()
                .requestId(request.getId())
                .tier(request.getTier())
                .backendId(served ? backend.getId() : null)
                .latencyMs(latencyMs)
                .cost(cost)
                .price(price)
                .margin(margin)
                .attempts(decision != null ? decision.getAttemptCount() : 0)
                .success(served)
                .recordedAt(clock.instant())
                .build();

        totalRequests.increment();
        requestsByTier.get(request.getTier()).increment();
        if (served) {
            successfulRequests.increment();
            totalRevenue.accumulateAndGet(price, BigDecimal::add);
            totalCost.accumulateAndGet(cost, BigDecimal::add);
            backendStats.computeIfAbsent(backend.getId(), id -> new BackendStats()).add(latencyMs);
        } else {
            failedRequests.increment();
        }

        flush(record);
        return record;
    }

    public UsageSummaryDto summary() {
        long successes = successfulRequests.sum();
        BigDecimal revenue = totalRevenue.get();
        BigDecimal cost = totalCost.get();

        Map<String, Long> byTier = new LinkedHashMap<>();
        requestsByTier.forEach((tier, count) -> byTier.put(tier.getCode(), count.sum()));

        List<BackendUsageDto> backends = registry.ids().stream()
                .map(id -> {
                    BackendStats stats = backendStats.get(id);
                    long count = stats != null ? stats.requests.sum() : 0L;
                    return BackendUsageDto.builder()
                            .backendId(id)
                            .requestCount(count)
                            .share(successes > 0 ? (double) count / successes : 0.0)
                            .avgLatencyMs(count > 0 ? (double) stats.latencyMs.sum() / count : 0.0)
                            .build();
                })
                .toList();

        return UsageSummaryDto.builder()
                .totalRequests(totalRequests.sum())
                .successfulRequests(successes)
                .failedRequests(failedRequests.sum())
                .totalRevenue(revenue)
                .totalCost(cost)
                .totalMargin(revenue.subtract(cost))
                .requestsByTier(byTier)
                .backends(backends)
                .meteringWriteFailures(meteringWriteFailures.sum())
                .negativeMarginRecords(negativeMarginRecords.sum())
                .build();
    }

    private void flush(UsageRecord record) {
        Mono.fromRunnable(() -> sink.write(record))
                .subscribeOn(flushScheduler)
                .doOnError(e -> {
                    meteringWriteFailures.increment();
                    log.error("MeteringWriteFailed: usage record for request {} was not persisted",
                            record.getRequestId(), e);
                })
                .onErrorResume(e -> Mono.empty())
                .subscribe();
    }

    private static final class BackendStats {
        private final LongAdder requests = new LongAdder();
        private final LongAdder latencyMs = new LongAdder();

        void add(long latency) {
            requests.increment();
            latencyMs.add(latency);
        }
    }
}
