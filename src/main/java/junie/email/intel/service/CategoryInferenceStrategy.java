package junie.email.intel.service;

import junie.email.intel.entity.EmailRecord;

/**
 * Assigns a coarse category to an email without calling the AI capability.
 */
public interface CategoryInferenceStrategy {
    String MARKETING = "marketing";
    String NEWSLETTER = "newsletter";
    String SOCIAL = "social";
    String AUTOMATED = "automated";
    String PERSONAL = "personal";

    String inferCategory(EmailRecord email);
}
