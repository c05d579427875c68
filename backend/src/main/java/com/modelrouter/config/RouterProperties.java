package com.modelrouter.config;

import com.modelrouter.model.routing.BackendClass;
import com.modelrouter.model.routing.ModelBackend;
import com.modelrouter.model.routing.Tier;
import com.modelrouter.model.routing.TierPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything the router reads from configuration, bound from {@code router.*}.
 * Field initializers are the defaults used when a property is absent.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "router")
public class RouterProperties {

    @Valid
    @NotEmpty
    private List<Backend> backends = new ArrayList<>(List.of(
            new Backend("llama3.2:3b", BackendClass.LIGHTWEIGHT, "http://localhost:11434", "llama3.2:3b", BigDecimal.ZERO),
            new Backend("gpt-oss:20b", BackendClass.HEAVYWEIGHT, "http://localhost:11434", "gpt-oss:20b", BigDecimal.ZERO)
    ));

    @Valid
    @NotEmpty
    private Map<Tier, TierSettings> tiers = defaultTiers();

    @Valid
    private Health health = new Health();

    @Valid
    private Dispatch dispatch = new Dispatch();

    @Valid
    private Batch batch = new Batch();

    private Response response = new Response();

    public List<ModelBackend> toModelBackends() {
        return backends.stream()
                .map(b -> ModelBackend.builder()
                        .id(b.getId())
                        .backendClass(b.getBackendClass())
                        .baseUrl(stripTrailingSlash(b.getBaseUrl()))
                        .model(b.getModel() != null ? b.getModel() : b.getId())
                        .costPerRequest(b.getCostPerRequest())
                        .build())
                .toList();
    }

    public List<TierPolicy> toTierPolicies() {
        return tiers.entrySet().stream()
                .map(e -> TierPolicy.builder()
                        .tier(e.getKey())
                        .threshold(e.getValue().getThreshold())
                        .belowThreshold(List.copyOf(e.getValue().getBelowThreshold()))
                        .atOrAboveThreshold(List.copyOf(e.getValue().getAtOrAboveThreshold()))
                        .price(e.getValue().getPrice())
                        .build())
                .toList();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static Map<Tier, TierSettings> defaultTiers() {
        Map<Tier, TierSettings> tiers = new LinkedHashMap<>();
        tiers.put(Tier.BASIC, new TierSettings(new BigDecimal("0.01"), 0.6,
                List.of(BackendClass.LIGHTWEIGHT),
                List.of(BackendClass.LIGHTWEIGHT, BackendClass.HEAVYWEIGHT)));
        tiers.put(Tier.PREMIUM, new TierSettings(new BigDecimal("0.02"), 0.4,
                List.of(BackendClass.LIGHTWEIGHT, BackendClass.HEAVYWEIGHT),
                List.of(BackendClass.HEAVYWEIGHT, BackendClass.LIGHTWEIGHT)));
        tiers.put(Tier.ENTERPRISE, new TierSettings(new BigDecimal("0.05"), 0.0,
                List.of(BackendClass.HEAVYWEIGHT, BackendClass.LIGHTWEIGHT),
                List.of(BackendClass.HEAVYWEIGHT, BackendClass.LIGHTWEIGHT)));
        return tiers;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Backend {
        @NotBlank
        private String id;

        @NotNull
        private BackendClass backendClass;

        @NotBlank
        private String baseUrl;

        /** Defaults to the backend id. */
        private String model;

        @NotNull
        @DecimalMin("0")
        private BigDecimal costPerRequest = BigDecimal.ZERO;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TierSettings {
        @NotNull
        @DecimalMin("0")
        private BigDecimal price;

        private double threshold;

        @NotEmpty
        private List<BackendClass> belowThreshold;

        @NotEmpty
        private List<BackendClass> atOrAboveThreshold;
    }

    @Data
    public static class Health {
        /** When false, no liveness probes are sent; breaker timers still advance. */
        private boolean enabled = true;

        @NotNull
        private Duration probeInterval = Duration.ofSeconds(10);

        @NotNull
        private Duration probeTimeout = Duration.ofSeconds(2);

        @Min(1)
        private int failureThreshold = 3;

        @NotNull
        private Duration coolDown = Duration.ofSeconds(30);

        @NotNull
        private Duration maxCoolDown = Duration.ofMinutes(5);

        @DecimalMin("1.0")
        private double backoffMultiplier = 2.0;
    }

    @Data
    public static class Dispatch {
        @NotNull
        private Duration timeout = Duration.ofSeconds(30);

        /** Upper bound on backend calls per request, across all classes. */
        @Min(1)
        private int maxAttempts = 4;
    }

    @Data
    public static class Batch {
        @Min(1)
        private int maxSize = 50;
    }

    @Data
    public static class Response {
        private boolean cleanFiller = true;
    }
}
