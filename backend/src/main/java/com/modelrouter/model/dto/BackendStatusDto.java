package com.modelrouter.model.dto;

import com.modelrouter.model.routing.BackendClass;
import com.modelrouter.model.routing.HealthState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

@Data
@Builder
@AllArgsConstructor
public class BackendStatusDto {
    private String id;
    private BackendClass backendClass;
    private String model;
    private String baseUrl;
    private BigDecimal costPerRequest;
    private HealthState health;
    private Integer consecutiveFailures;
}
