package junie.email.intel.entity;

import jakarta.persistence.*;
import junie.email.intel.model.DigestContent;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "weekly_digests",
        uniqueConstraints = @UniqueConstraint(columnNames = {"user_id", "week_start"}))
@Data
public class WeeklyDigest {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "week_start", nullable = false)
    private LocalDate weekStart;

    @Column(name = "week_end", nullable = false)
    private LocalDate weekEnd;

    @Enumerated(EnumType.STRING)
    private DigestStatus status;

    private int totalLowPriorityEmails;

    @Convert(converter = DigestContentConverter.class)
    @Column(columnDefinition = "TEXT")
    private DigestContent content;

    // AI spend avoided by not analysing these emails
    @Column(precision = 12, scale = 6)
    private BigDecimal costSavingsCents;

    private Instant generatedAt;

    private Instant userViewedAt;

    private Instant actionsCompletedAt;
}
