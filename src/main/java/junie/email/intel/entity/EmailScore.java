package junie.email.intel.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

@Entity
@Table(name = "email_scores")
@Data
public class EmailScore {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "email_record_id", unique = true, nullable = false)
    private EmailRecord emailRecord;

    private int rawScore;

    private int finalScore;

    @Enumerated(EnumType.STRING)
    private ProcessingTier processingTier;

    @Embedded
    private ScoreFactors factors;

    // Category from the local heuristic, kept so the digest does not need to re-infer
    private String inferredCategory;

    @Enumerated(EnumType.STRING)
    private AiStatus aiStatus;

    private boolean aiProcessed;

    @Embedded
    private AiAnalysis aiAnalysis;

    private String correctedCategory;

    private Instant scoredAt;

    private Instant updatedAt;
}
