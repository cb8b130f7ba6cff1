package junie.email.intel.model;

import junie.email.intel.entity.UserActionType;
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
public class FeedbackRequest {
    private UserActionType action;

    /** Required for CATEGORY_CORRECTION. */
    private String correctedCategory;

    /** Extra patterns to learn, each {@code type:value}, e.g. {@code subject:invoice}. */
    @Builder.Default
    private List<String> patterns = new ArrayList<>();

    @Builder.Default
    private String source = "email";
}
