package junie.email.intel.model;

import junie.email.intel.entity.ProcessingTier;
import lombok.Value;

@Value
public class RoutingDecision {
    ProcessingTier tier;
    AiDecision aiDecision;
}
