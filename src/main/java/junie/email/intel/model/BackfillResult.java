package junie.email.intel.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class BackfillResult {
    int scored;
    int failed;
    @Singular
    List<EmailScoreView> scores;
    @Singular
    List<String> errors;
}
