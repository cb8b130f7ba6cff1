package junie.email.intel.model;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import junie.email.intel.entity.VipStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class VipSenderRequest {
    @NotBlank
    private String senderEmail;

    @Min(0)
    @Max(50)
    private int scoreBoost = 25;

    private String autoCategory;

    /** Defaults to ACTIVE. */
    private VipStatus status;
}
