package com.modelrouter.service;

import com.modelrouter.exception.InvalidTierException;
import com.modelrouter.model.routing.BackendClass;
import com.modelrouter.model.routing.ComplexityScore;
import com.modelrouter.model.routing.ModelBackend;
import com.modelrouter.model.routing.Tier;
import com.modelrouter.model.routing.TierPolicy;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lookup table from (tier, complexity score) to the ordered list of backend classes to try.
 * <p>
 * The table is validated on construction: every tier must have a policy, every class list
 * must be non-empty, prices must not be negative, and escalation thresholds must strictly
 * decrease from basic to enterprise so that higher tiers reach the heavyweight class sooner.
 */
public class TierPolicyResolver {

    private final Map<Tier, TierPolicy> policies;

    public TierPolicyResolver(Collection<TierPolicy> configured) {
        Map<Tier, TierPolicy> table = new EnumMap<>(Tier.class);
        for (TierPolicy policy : configured) {
            if (table.put(policy.getTier(), policy) != null) {
                throw new IllegalArgumentException("Duplicate policy for tier " + policy.getTier().getCode());
            }
            if (policy.getBelowThreshold().isEmpty() || policy.getAtOrAboveThreshold().isEmpty()) {
                throw new IllegalArgumentException("Tier " + policy.getTier().getCode() + " must accept at least one backend class");
            }
            if (policy.getPrice().compareTo(BigDecimal.ZERO) < 0) {
                throw new IllegalArgumentException("Tier " + policy.getTier().getCode() + " has a negative price");
            }
        }
        TierPolicy lower = null;
        for (Tier tier : Tier.values()) {
            TierPolicy policy = table.get(tier);
            if (policy == null) {
                throw new IllegalArgumentException("No routing policy configured for tier " + tier.getCode());
            }
            if (lower != null && policy.getThreshold() >= lower.getThreshold()) {
                throw new IllegalArgumentException("Threshold of tier " + tier.getCode()
                        + " must be below the threshold of tier " + lower.getTier().getCode());
            }
            lower = policy;
        }
        this.policies = Collections.unmodifiableMap(table);
    }

    public List<BackendClass> resolve(Tier tier, ComplexityScore score) {
        return policyFor(tier).classesFor(score.getValue());
    }

    public List<BackendClass> resolve(String tier, ComplexityScore score) {
        return resolve(Tier.parse(tier), score);
    }

    public TierPolicy policyFor(Tier tier) {
        if (tier == null) {
            throw new InvalidTierException(null);
        }
        return policies.get(tier);
    }

    public BigDecimal priceFor(Tier tier) {
        return policyFor(tier).getPrice();
    }

    /**
     * Backends that a tier's policy can reach but whose cost per request exceeds the tier's
     * price, keyed by tier. Empty when pricing covers every reachable backend.
     */
    public Map<Tier, List<String>> underpricedBackends(BackendRegistry registry) {
        Map<Tier, List<String>> underpriced = new EnumMap<>(Tier.class);
        policies.forEach((tier, policy) -> {
            Set<BackendClass> reachable = EnumSet.noneOf(BackendClass.class);
            reachable.addAll(policy.getBelowThreshold());
            reachable.addAll(policy.getAtOrAboveThreshold());
            List<String> ids = reachable.stream()
                    .flatMap(backendClass -> registry.get(backendClass).stream())
                    .filter(backend -> backend.getCostPerRequest().compareTo(policy.getPrice()) > 0)
                    .map(ModelBackend::getId)
                    .toList();
            if (!ids.isEmpty()) {
                underpriced.put(tier, ids);
            }
        });
        return underpriced;
    }
}
