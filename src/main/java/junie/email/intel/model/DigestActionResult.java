package junie.email.intel.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class DigestActionResult {
    String digestId;
    int applied;
    @Singular("skip")
    List<String> skipped;
}
