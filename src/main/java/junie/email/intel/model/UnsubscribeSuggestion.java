package junie.email.intel.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UnsubscribeSuggestion {
    private String sender;
    private String domain;
    private String category;
    private int count;
    private double confidence;
}
