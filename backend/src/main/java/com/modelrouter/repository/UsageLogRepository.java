package com.modelrouter.repository;

import com.modelrouter.model.entity.UsageLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

public interface UsageLogRepository extends JpaRepository<UsageLog, UUID> {
    List<UsageLog> findByRequestId(String requestId);

    long countByStatus(String status);

    @Query("SELECT COALESCE(SUM(u.margin), 0) FROM UsageLog u WHERE u.tier = :tier")
    BigDecimal sumMarginByTier(@Param("tier") String tier);
}
