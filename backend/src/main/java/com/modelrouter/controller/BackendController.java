package com.modelrouter.controller;

import com.modelrouter.model.dto.BackendStatusDto;
import com.modelrouter.model.routing.HealthState;
import com.modelrouter.model.routing.ModelBackend;
import com.modelrouter.service.BackendRegistry;
import com.modelrouter.service.health.HealthMonitor;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class BackendController {

    private final BackendRegistry backendRegistry;
    private final HealthMonitor healthMonitor;

    @GetMapping("/backends")
    public ResponseEntity<List<BackendStatusDto>> listBackends() {
        return ResponseEntity.ok(backendStatuses());
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        List<BackendStatusDto> backends = backendStatuses();
        long available = backends.stream().filter(b -> b.getHealth() != HealthState.OPEN).count();

        String status;
        if (available == backends.size()) {
            status = "operational";
        } else if (available > 0) {
            status = "degraded";
        } else {
            status = "unavailable";
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status);
        body.put("availableBackends", available);
        body.put("backends", backends);
        return ResponseEntity.ok(body);
    }

    private List<BackendStatusDto> backendStatuses() {
        return backendRegistry.all().stream()
                .map(this::toDto)
                .toList();
    }

    private BackendStatusDto toDto(ModelBackend backend) {
        return BackendStatusDto.builder()
                .id(backend.getId())
                .backendClass(backend.getBackendClass())
                .model(backend.getModel())
                .baseUrl(backend.getBaseUrl())
                .costPerRequest(backend.getCostPerRequest())
                .health(backend.getHealth())
                .consecutiveFailures(healthMonitor.consecutiveFailures(backend.getId()))
                .build();
    }
}
