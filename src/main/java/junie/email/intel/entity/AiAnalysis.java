package junie.email.intel.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AiAnalysis {
    @Column(name = "ai_category")
    private String category;

    @Column(name = "ai_priority")
    private Integer priority; // 1-10

    @Column(name = "ai_summary", columnDefinition = "TEXT")
    private String summary;

    // Newline separated
    @Column(name = "ai_action_items", columnDefinition = "TEXT")
    private String actionItems;

    @Column(name = "ai_confidence")
    private Double confidence;

    @Column(name = "ai_cost_cents", precision = 12, scale = 6)
    private BigDecimal costCents;

    @Column(name = "ai_latency_ms")
    private Long latencyMs;

    @Column(name = "ai_model")
    private String model;
}
