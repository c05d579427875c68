package com.modelrouter.service;

import com.modelrouter.model.routing.BackendClass;
import com.modelrouter.model.routing.HealthState;
import com.modelrouter.model.routing.ModelBackend;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public class BackendRegistry {

    private final List<String> order;
    private final Map<String, ModelBackend> backends = new ConcurrentHashMap<>();

    public BackendRegistry(List<ModelBackend> configured) {
        if (configured == null || configured.isEmpty()) {
            throw new IllegalArgumentException("At least one model backend must be configured");
        }
        Set<String> seen = new HashSet<>();
        for (ModelBackend backend : configured) {
            if (!seen.add(backend.getId())) {
                throw new IllegalArgumentException("Duplicate backend id: " + backend.getId());
            }
            if (backend.getCostPerRequest().compareTo(BigDecimal.ZERO) < 0) {
                throw new IllegalArgumentException("Backend " + backend.getId() + " has a negative cost per request");
            }
            backends.put(backend.getId(), backend);
        }
        this.order = configured.stream().map(ModelBackend::getId).toList();
    }

    /** Backends of the given class in configuration order, with their current health. */
    public List<ModelBackend> get(BackendClass backendClass) {
        return order.stream()
                .map(backends::get)
                .filter(b -> b.getBackendClass() == backendClass)
                .toList();
    }

    public Optional<ModelBackend> find(String id) {
        return Optional.ofNullable(id).map(backends::get);
    }

    public List<ModelBackend> all() {
        return order.stream().map(backends::get).toList();
    }

    public List<String> ids() {
        return order;
    }

    /**
     * Replaces the backend's health state.
     *
     * @return the previous state
     */
    public HealthState setHealth(String id, HealthState state) {
        HealthState[] previous = new HealthState[1];
        ModelBackend updated = backends.computeIfPresent(id, (k, current) -> {
            previous[0] = current.getHealth();
            return current.withHealth(state);
        });
        if (updated == null) {
            throw new IllegalArgumentException("Unknown backend: " + id);
        }
        return previous[0];
    }
}
