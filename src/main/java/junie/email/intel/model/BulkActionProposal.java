package junie.email.intel.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import junie.email.intel.entity.DigestActionType;
import junie.email.intel.entity.DigestTargetType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BulkActionProposal {
    private DigestActionType action;

    @JsonProperty("target_type")
    private DigestTargetType targetType;

    @JsonProperty("target_value")
    private String targetValue;

    @Builder.Default
    private List<String> senders = new ArrayList<>();

    @JsonProperty("email_count")
    private int emailCount;

    private double confidence;
}
