package junie.email.intel.model;

import junie.email.intel.entity.VipStatus;
import lombok.Value;

@Value
public class VipPromotion {
    String senderEmail;
    double confidence;
    /** SUGGESTED unless the user's policy applies promotions automatically. */
    VipStatus status;
}
