package junie.email.intel.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BudgetAlertEvent {
    private String userId;
    private String window; // "daily" or "monthly"
    private double percentUsed;
    private long usageCents;
    private long limitCents;
    private String message;
}
