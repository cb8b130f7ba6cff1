package junie.email.intel.model;

import junie.email.intel.entity.DigestActionType;
import junie.email.intel.entity.DigestTargetType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DigestActionRequest {
    private DigestActionType action;
    private DigestTargetType targetType;
    private String targetValue;
}
