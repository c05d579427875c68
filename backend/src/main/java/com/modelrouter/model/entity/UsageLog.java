package com.modelrouter.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "usage_logs")
@Getter @Setter
@NoArgsConstructor @AllArgsConstructor
@Builder
public class UsageLog {

    public static final String STATUS_SUCCESS = "SUCCESS";
    public static final String STATUS_ERROR = "ERROR";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "request_id", nullable = false)
    private String requestId;

    @Column(nullable = false)
    private String tier;

    @Column(name = "backend_id")
    private String backendId;

    @Column(name = "latency_ms")
    @Builder.Default
    private Long latencyMs = 0L;

    @Column(precision = 12, scale = 6)
    @Builder.Default
    private BigDecimal cost = BigDecimal.ZERO;

    @Column(precision = 12, scale = 6)
    @Builder.Default
    private BigDecimal price = BigDecimal.ZERO;

    @Column(precision = 12, scale = 6)
    @Builder.Default
    private BigDecimal margin = BigDecimal.ZERO;

    @Builder.Default
    private Integer attempts = 1;

    @Builder.Default
    private String status = STATUS_SUCCESS;

    @CreationTimestamp
    @Column(name = "created_at")
    private OffsetDateTime createdAt;
}
