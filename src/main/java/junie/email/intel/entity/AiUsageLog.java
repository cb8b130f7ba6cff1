package junie.email.intel.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One row per AI attempt, successful or not.
 */
@Entity
@Table(name = "ai_usage_logs")
@Data
public class AiUsageLog {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    private String emailRecordId;

    private String model;

    private int attempt;

    private long promptTokens;

    private long completionTokens;

    @Column(precision = 12, scale = 6)
    private BigDecimal costCents;

    private long chargedCents;

    private long latencyMs;

    private boolean success;

    private String errorType;

    @Column(length = 1000)
    private String errorMessage;

    private Instant createdAt;
}
