package com.modelrouter.controller;

import com.modelrouter.model.dto.PersistedUsageDto;
import com.modelrouter.model.dto.UsageLogDto;
import com.modelrouter.model.dto.UsageSummaryDto;
import com.modelrouter.service.UsageHistoryService;
import com.modelrouter.service.UsageMeteringService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/usage")
@RequiredArgsConstructor
public class UsageController {

    private final UsageMeteringService usageMeteringService;
    private final UsageHistoryService usageHistoryService;

    @GetMapping("/summary")
    public ResponseEntity<UsageSummaryDto> summary() {
        return ResponseEntity.ok(usageMeteringService.summary());
    }

    @GetMapping("/persisted")
    public ResponseEntity<PersistedUsageDto> persisted() {
        return ResponseEntity.ok(usageHistoryService.getPersistedSummary());
    }

    @GetMapping("/requests/{requestId}")
    public ResponseEntity<List<UsageLogDto>> requestHistory(@PathVariable String requestId) {
        List<UsageLogDto> history = usageHistoryService.getRequestHistory(requestId);
        return history.isEmpty() ? ResponseEntity.notFound().build() : ResponseEntity.ok(history);
    }
}
