package junie.email.intel.model;

import junie.email.intel.entity.LearnedPattern;
import junie.email.intel.entity.ScoringPreferences;
import junie.email.intel.entity.SenderReputation;
import junie.email.intel.entity.VipSender;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Everything the scoring engine knows about a user, loaded up front so that scoring
 * itself touches no storage. Keys of the maps are normalized sender addresses.
 */
@Value
@Builder
public class ScoringProfile {
    String userId;
    ScoringPreferences preferences;
    @Singular
    Map<String, VipSender> vipSenders;
    @Singular
    Map<String, SenderReputation> reputations;
    /** Only confident patterns are expected here; the engine re-checks anyway. */
    @Singular
    List<LearnedPattern> patterns;

    public static ScoringProfile coldStart(String userId, ScoringPreferences preferences) {
        return ScoringProfile.builder().userId(userId).preferences(preferences).build();
    }
}
