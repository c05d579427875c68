package com.modelrouter.service;

import com.modelrouter.model.dto.PersistedUsageDto;
import com.modelrouter.model.dto.UsageLogDto;
import com.modelrouter.model.entity.UsageLog;
import com.modelrouter.model.routing.Tier;
import com.modelrouter.repository.UsageLogRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class UsageHistoryService {

    private final UsageLogRepository usageLogRepository;

    public PersistedUsageDto getPersistedSummary() {
        Map<String, BigDecimal> marginByTier = new LinkedHashMap<>();
        for (Tier tier : Tier.values()) {
            marginByTier.put(tier.getCode(), usageLogRepository.sumMarginByTier(tier.getCode()));
        }
        return PersistedUsageDto.builder()
                .successfulRequests(usageLogRepository.countByStatus(UsageLog.STATUS_SUCCESS))
                .failedRequests(usageLogRepository.countByStatus(UsageLog.STATUS_ERROR))
                .marginByTier(marginByTier)
                .build();
    }

    public List<UsageLogDto> getRequestHistory(String requestId) {
        return usageLogRepository.findByRequestId(requestId).stream()
                .map(entry -> UsageLogDto.builder()
                        .requestId(entry.getRequestId())
                        .tier(entry.getTier())
                        .backendId(entry.getBackendId())
                        .latencyMs(entry.getLatencyMs())
                        .cost(entry.getCost())
                        .price(entry.getPrice())
                        .margin(entry.getMargin())
                        .attempts(entry.getAttempts())
                        .status(entry.getStatus())
                        .createdAt(entry.getCreatedAt())
                        .build())
                .toList();
    }
}
