package junie.email.intel.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON body of a weekly digest.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DigestContent {
    @Builder.Default
    private Map<String, DigestCategorySummary> categories = new LinkedHashMap<>();

    @JsonProperty("safe_to_unsubscribe")
    @Builder.Default
    private List<UnsubscribeSuggestion> safeToUnsubscribe = new ArrayList<>();

    @JsonProperty("needs_review")
    @Builder.Default
    private List<UnsubscribeSuggestion> needsReview = new ArrayList<>();

    @JsonProperty("bulk_actions")
    @Builder.Default
    private List<BulkActionProposal> bulkActions = new ArrayList<>();

    @Builder.Default
    private List<String> failures = new ArrayList<>();
}
