package junie.email.intel.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

@Entity
@Table(name = "learned_patterns",
        uniqueConstraints = @UniqueConstraint(columnNames = {"user_id", "pattern_type", "pattern_value"}))
@Data
public class LearnedPattern {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "pattern_type", nullable = false)
    private PatternType patternType;

    @Column(name = "pattern_value", nullable = false)
    private String patternValue;

    private double scoreImpact; // -50..50

    private double confidenceScore;

    private int sampleCount;

    private int positiveCount;

    private int negativeCount;

    private double successRate;

    private Instant lastSeenAt;

    private Instant createdAt;
}
