package com.modelrouter.service;

import com.modelrouter.config.RouterProperties;
import com.modelrouter.model.dto.BackendUsageDto;
import com.modelrouter.model.dto.UsageSummaryDto;
import com.modelrouter.model.routing.AttemptOutcome;
import com.modelrouter.model.routing.BackendClass;
import com.modelrouter.model.routing.DispatchAttempt;
import com.modelrouter.model.routing.ModelBackend;
import com.modelrouter.model.routing.RoutingDecision;
import com.modelrouter.model.routing.RoutingRequest;
import com.modelrouter.model.routing.Tier;
import com.modelrouter.model.routing.UsageRecord;
import com.modelrouter.support.MutableClock;
import com.modelrouter.support.RouterFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.scheduler.Schedulers;

import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.modelrouter.support.RouterFixtures.HEAVY_1;
import static com.modelrouter.support.RouterFixtures.LIGHT_1;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class UsageMeteringServiceTest {

    @Mock
    private UsageRecordSink sink;

    private UsageMeteringService metering;

    @BeforeEach
    void setUp() {
        RouterProperties properties = RouterFixtures.properties();
        metering = new UsageMeteringService(
                new TierPolicyResolver(properties.toTierPolicies()),
                new BackendRegistry(properties.toModelBackends()),
                sink,
                new MutableClock(),
                Schedulers.immediate());
    }

    private static RoutingRequest request(String id, Tier tier) {
        return RoutingRequest.builder().id(id).prompt("p").tier(tier).build();
    }

    private static RoutingDecision servedBy(String backendId, BackendClass backendClass) {
        return new RoutingDecision(backendId, backendClass,
                List.of(new DispatchAttempt(1, backendClass, backendId, AttemptOutcome.SUCCESS, 12, null)),
                "served by first choice");
    }

    private static RoutingDecision exhausted() {
        return new RoutingDecision(null, null,
                List.of(new DispatchAttempt(1, BackendClass.LIGHTWEIGHT, null, AttemptOutcome.UNAVAILABLE, 0, "none")),
                "exhausted");
    }

    @Test
    void marginIsPriceMinusCost() {
        UsageRecord record = metering.record(request("r1", Tier.PREMIUM), servedBy(HEAVY_1, BackendClass.HEAVYWEIGHT), 40, true);

        assertThat(record.getPrice()).isEqualByComparingTo("0.02");
        assertThat(record.getCost()).isEqualByComparingTo(RouterFixtures.HEAVY_COST);
        assertThat(record.getMargin()).isEqualByComparingTo(record.getPrice().subtract(record.getCost()));
        assertThat(record.isSuccess()).isTrue();
        assertThat(record.getAttempts()).isEqualTo(1);
    }

    @Test
    void configuredPricingCoversEveryReachableBackend() {
        for (RouterProperties properties : List.of(new RouterProperties(), RouterFixtures.properties())) {
            BackendRegistry registry = new BackendRegistry(properties.toModelBackends());
            TierPolicyResolver resolver = new TierPolicyResolver(properties.toTierPolicies());
            UsageMeteringService service = new UsageMeteringService(resolver, registry, sink,
                    new MutableClock(), Schedulers.immediate());

            for (Tier tier : Tier.values()) {
                for (ModelBackend backend : registry.all()) {
                    UsageRecord record = service.record(request(tier.getCode() + "-" + backend.getId(), tier),
                            servedBy(backend.getId(), backend.getBackendClass()), 5, true);
                    assertThat(record.getMargin().signum())
                            .as("margin for %s on %s", tier, backend.getId())
                            .isGreaterThanOrEqualTo(0);
                }
            }
            assertThat(service.summary().getNegativeMarginRecords()).isZero();
            assertThat(resolver.underpricedBackends(registry)).isEmpty();
        }
    }

    @Test
    void priceBelowCostIsFlagged() {
        RouterProperties properties = RouterFixtures.properties();
        properties.getBackends().get(2).setCostPerRequest(new BigDecimal("0.03"));
        BackendRegistry registry = new BackendRegistry(properties.toModelBackends());
        TierPolicyResolver resolver = new TierPolicyResolver(properties.toTierPolicies());
        UsageMeteringService service = new UsageMeteringService(resolver, registry, sink,
                new MutableClock(), Schedulers.immediate());

        UsageRecord loss = service.record(request("loss", Tier.BASIC), servedBy(HEAVY_1, BackendClass.HEAVYWEIGHT), 5, true);
        service.record(request("profit", Tier.ENTERPRISE), servedBy(HEAVY_1, BackendClass.HEAVYWEIGHT), 5, true);

        assertThat(loss.getMargin()).isEqualByComparingTo("-0.02");
        assertThat(service.summary().getNegativeMarginRecords()).isEqualTo(1);
        assertThat(resolver.underpricedBackends(registry))
                .containsOnlyKeys(Tier.BASIC, Tier.PREMIUM)
                .containsEntry(Tier.BASIC, List.of(HEAVY_1));
    }

    @Test
    void failedRequestCarriesZeroAmounts() {
        UsageRecord record = metering.record(request("r2", Tier.BASIC), exhausted(), 5, false);

        assertThat(record.isSuccess()).isFalse();
        assertThat(record.getBackendId()).isNull();
        assertThat(record.getPrice()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(record.getCost()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(record.getMargin()).isEqualByComparingTo(BigDecimal.ZERO);

        UsageSummaryDto summary = metering.summary();
        assertThat(summary.getFailedRequests()).isEqualTo(1);
        assertThat(summary.getTotalRevenue()).isEqualByComparingTo(BigDecimal.ZERO);
    }

    @Test
    void everyRecordIsHandedToTheSink() {
        metering.record(request("r3", Tier.BASIC), servedBy(LIGHT_1, BackendClass.LIGHTWEIGHT), 8, true);

        ArgumentCaptor<UsageRecord> captor = ArgumentCaptor.forClass(UsageRecord.class);
        verify(sink).write(captor.capture());
        assertThat(captor.getValue().getRequestId()).isEqualTo("r3");
        assertThat(captor.getValue().getBackendId()).isEqualTo(LIGHT_1);
    }

    @Test
    void sinkFailureIsCountedAndNotPropagated() {
        doThrow(new IllegalStateException("disk full")).when(sink).write(any());

        UsageRecord record = metering.record(request("r4", Tier.BASIC), servedBy(LIGHT_1, BackendClass.LIGHTWEIGHT), 8, true);

        assertThat(record.isSuccess()).isTrue();
        assertThat(metering.summary().getMeteringWriteFailures()).isEqualTo(1);
        assertThat(metering.summary().getSuccessfulRequests()).isEqualTo(1);
    }

    @Test
    void summaryReportsPerTierAndPerBackendFigures() {
        metering.record(request("a", Tier.BASIC), servedBy(LIGHT_1, BackendClass.LIGHTWEIGHT), 10, true);
        metering.record(request("b", Tier.BASIC), servedBy(LIGHT_1, BackendClass.LIGHTWEIGHT), 30, true);
        metering.record(request("c", Tier.ENTERPRISE), servedBy(HEAVY_1, BackendClass.HEAVYWEIGHT), 100, true);
        metering.record(request("d", Tier.PREMIUM), exhausted(), 3, false);

        UsageSummaryDto summary = metering.summary();

        assertThat(summary.getTotalRequests()).isEqualTo(4);
        assertThat(summary.getRequestsByTier()).containsEntry("basic", 2L).containsEntry("premium", 1L)
                .containsEntry("enterprise", 1L);
        assertThat(summary.getTotalRevenue()).isEqualByComparingTo("0.07");
        assertThat(summary.getTotalCost()).isEqualByComparingTo("0.003");
        assertThat(summary.getTotalMargin()).isEqualByComparingTo("0.067");

        BackendUsageDto light = summary.getBackends().get(0);
        assertThat(light.getBackendId()).isEqualTo(LIGHT_1);
        assertThat(light.getRequestCount()).isEqualTo(2);
        assertThat(light.getAvgLatencyMs()).isEqualTo(20.0);
        assertThat(light.getShare()).isCloseTo(2.0 / 3.0, within(1e-9));
    }

    @Test
    void concurrentRecordsAreAllCounted() throws InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        int perThread = 250;
        for (int t = 0; t < 8; t++) {
            int thread = t;
            pool.submit(() -> {
                for (int i = 0; i < perThread; i++) {
                    metering.record(request(thread + "-" + i, Tier.PREMIUM),
                            servedBy(HEAVY_1, BackendClass.HEAVYWEIGHT), 1, true);
                }
            });
        }
        pool.shutdown();
        assertThat(pool.awaitTermination(30, TimeUnit.SECONDS)).isTrue();

        UsageSummaryDto summary = metering.summary();
        assertThat(summary.getTotalRequests()).isEqualTo(2000);
        assertThat(summary.getTotalRevenue()).isEqualByComparingTo(new BigDecimal("0.02").multiply(BigDecimal.valueOf(2000)));
        assertThat(summary.getTotalMargin())
                .isEqualByComparingTo(summary.getTotalRevenue().subtract(summary.getTotalCost()));
        verify(sink, times(2000)).write(any());
    }
}
