package junie.email.intel.model;

import com.fasterxml.jackson.annotation.JsonProperty;
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
public class DigestCategorySummary {
    private int count;

    @Builder.Default
    private List<String> senders = new ArrayList<>();

    @JsonProperty("sample_subjects")
    @Builder.Default
    private List<String> sampleSubjects = new ArrayList<>();
}
