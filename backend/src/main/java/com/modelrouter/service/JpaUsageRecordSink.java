package com.modelrouter.service;

import com.modelrouter.model.entity.UsageLog;
import com.modelrouter.model.routing.UsageRecord;
import com.modelrouter.repository.UsageLogRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class JpaUsageRecordSink implements UsageRecordSink {

    private final UsageLogRepository usageLogRepository;

    @Override
    public void write(UsageRecord record) {
        UsageLog usageLog = UsageLog.builder()
                .requestId(record.getRequestId())
                .tier(record.getTier().getCode())
                .backendId(record.getBackendId())
                .latencyMs(record.getLatencyMs())
                .cost(record.getCost())
                .price(record.getPrice())
                .margin(record.getMargin())
                .attempts(record.getAttempts())
                .status(record.isSuccess() ? UsageLog.STATUS_SUCCESS : UsageLog.STATUS_ERROR)
                .build();
        usageLogRepository.save(usageLog);
    }
}
