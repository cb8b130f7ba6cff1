package junie.email.intel.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import junie.email.intel.entity.AiAnalysis;
import junie.email.intel.entity.AiStatus;
import junie.email.intel.entity.EmailScore;
import junie.email.intel.entity.ProcessingTier;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * API shape of a score record, using the factor and tier names consumers see.
 */
@Value
@Builder
public class EmailScoreView {
    @JsonProperty("email_id")
    String emailId;
    @JsonProperty("raw_score")
    int rawScore;
    @JsonProperty("final_score")
    int finalScore;
    @JsonProperty("processing_tier")
    ProcessingTier processingTier;
    Map<String, Integer> factors;
    @JsonProperty("inferred_category")
    String inferredCategory;
    @JsonProperty("corrected_category")
    String correctedCategory;
    @JsonProperty("ai_decision")
    AiDecision aiDecision;
    @JsonProperty("ai_status")
    AiStatus aiStatus;
    @JsonProperty("ai_processed")
    boolean aiProcessed;
    @JsonProperty("ai_analysis")
    AiAnalysis aiAnalysis;
    @JsonProperty("scored_at")
    Instant scoredAt;

    public static EmailScoreView of(EmailScore score, AiDecision decision) {
        return EmailScoreView.builder()
                .emailId(score.getEmailRecord().getId())
                .rawScore(score.getRawScore())
                .finalScore(score.getFinalScore())
                .processingTier(score.getProcessingTier())
                .factors(score.getFactors() != null ? score.getFactors().asMap() : Map.of())
                .inferredCategory(score.getInferredCategory())
                .correctedCategory(score.getCorrectedCategory())
                .aiDecision(decision)
                .aiStatus(score.getAiStatus())
                .aiProcessed(score.isAiProcessed())
                .aiAnalysis(score.isAiProcessed() ? score.getAiAnalysis() : null)
                .scoredAt(score.getScoredAt())
                .build();
    }
}
