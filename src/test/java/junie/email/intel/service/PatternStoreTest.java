package junie.email.intel.service;

import junie.email.intel.config.LearningProperties;
import junie.email.intel.entity.LearnedPattern;
import junie.email.intel.entity.PatternType;
import junie.email.intel.entity.ScoringPreferences;
import junie.email.intel.entity.SenderReputation;
import junie.email.intel.entity.UserActionType.Feedback;
import junie.email.intel.entity.VipSender;
import junie.email.intel.entity.VipStatus;
import junie.email.intel.model.PatternUpdate;
import junie.email.intel.model.ScoringProfile;
import junie.email.intel.repository.LearnedPatternRepository;
import junie.email.intel.repository.ScoringPreferencesRepository;
import junie.email.intel.repository.SenderReputationRepository;
import junie.email.intel.repository.VipSenderRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PatternStoreTest {

    private static final String USER_ID = "user123";
    private static final Instant NOW = Instant.parse("2024-03-11T10:00:00Z");

    @Mock
    private VipSenderRepository vipSenderRepository;

    @Mock
    private SenderReputationRepository reputationRepository;

    @Mock
    private LearnedPatternRepository patternRepository;

    @Mock
    private ScoringPreferencesRepository preferencesRepository;

    private PatternStore patternStore;
    private LearnedPattern stored;

    @BeforeEach
    void setUp() {
        patternStore = new PatternStore(vipSenderRepository, reputationRepository, patternRepository,
                preferencesRepository, new LearningProperties());
        stored = new LearnedPattern();
        stored.setUserId(USER_ID);
        stored.setPatternType(PatternType.SUBJECT);
        stored.setPatternValue("invoice");
    }

    @Test
    void learn_WithRepeatedPositiveFeedback_ShouldBecomeConfidentOnlyAfterThirdSample() {
        // Given
        when(patternRepository.findByUserIdAndPatternTypeAndPatternValue(USER_ID, PatternType.SUBJECT, "invoice"))
                .thenReturn(Optional.of(stored));

        // When
        PatternUpdate first = patternStore.learn(USER_ID, PatternType.SUBJECT, "invoice", Feedback.POSITIVE, NOW);
        PatternUpdate second = patternStore.learn(USER_ID, PatternType.SUBJECT, "invoice", Feedback.POSITIVE, NOW);
        PatternUpdate third = patternStore.learn(USER_ID, PatternType.SUBJECT, "invoice", Feedback.POSITIVE, NOW);

        // Then
        assertEquals(5.0, first.getScoreImpact(), 1e-9);
        assertEquals(9.5, second.getScoreImpact(), 1e-9);
        assertEquals(13.55, third.getScoreImpact(), 1e-9);
        assertFalse(first.isConfident());
        assertFalse(second.isConfident());
        assertTrue(third.isConfident());
        assertEquals(1 - Math.exp(-1), third.getConfidenceScore(), 1e-9);
        verify(patternRepository, times(3)).save(stored);
    }

    @Test
    void learn_WithNegativeFeedback_ShouldMoveImpactDown() {
        // Given
        stored.setScoreImpact(10);
        when(patternRepository.findByUserIdAndPatternTypeAndPatternValue(USER_ID, PatternType.SUBJECT, "invoice"))
                .thenReturn(Optional.of(stored));

        // When
        PatternUpdate update = patternStore.learn(USER_ID, PatternType.SUBJECT, "invoice", Feedback.NEGATIVE, NOW);

        // Then
        assertEquals(10.0, update.getPreviousImpact(), 1e-9);
        assertEquals(4.0, update.getScoreImpact(), 1e-9);
        assertEquals(1, stored.getNegativeCount());
    }

    @Test
    void learn_WithMixedFeedback_ShouldScaleConfidenceBySuccessRate() {
        // Given
        stored.setPositiveCount(3);
        stored.setSampleCount(3);
        when(patternRepository.findByUserIdAndPatternTypeAndPatternValue(USER_ID, PatternType.SUBJECT, "invoice"))
                .thenReturn(Optional.of(stored));

        // When
        PatternUpdate update = patternStore.learn(USER_ID, PatternType.SUBJECT, "invoice", Feedback.NEGATIVE, NOW);

        // Then
        assertEquals(0.75, stored.getSuccessRate(), 1e-9);
        assertEquals((1 - Math.exp(-4 / 3.0)) * 0.75, update.getConfidenceScore(), 1e-9);
    }

    @Test
    void learn_WithNeutralFeedback_ShouldLeaveImpactAndSamplesAlone() {
        // Given
        stored.setScoreImpact(12);
        stored.setSampleCount(2);
        stored.setPositiveCount(2);
        when(patternRepository.findByUserIdAndPatternTypeAndPatternValue(USER_ID, PatternType.SUBJECT, "invoice"))
                .thenReturn(Optional.of(stored));

        // When
        PatternUpdate update = patternStore.learn(USER_ID, PatternType.SUBJECT, "invoice", Feedback.NEUTRAL, NOW);

        // Then
        assertEquals(12.0, update.getScoreImpact(), 1e-9);
        assertEquals(2, update.getSampleCount());
    }

    @Test
    void learn_WithUnknownPattern_ShouldCreateIt() {
        // Given
        when(patternRepository.findByUserIdAndPatternTypeAndPatternValue(USER_ID, PatternType.DOMAIN, "acme.com"))
                .thenReturn(Optional.empty());

        // When
        PatternUpdate update = patternStore.learn(USER_ID, PatternType.DOMAIN, "acme.com", Feedback.POSITIVE, NOW);

        // Then
        assertEquals(PatternType.DOMAIN, update.getPatternType());
        assertEquals(1, update.getSampleCount());
        verify(patternRepository).save(argThat((LearnedPattern pattern) -> USER_ID.equals(pattern.getUserId())
                && NOW.equals(pattern.getCreatedAt())));
    }

    @Test
    void learn_ManyPositiveSamples_ShouldNeverExceedMaxImpact() {
        // Given
        when(patternRepository.findByUserIdAndPatternTypeAndPatternValue(USER_ID, PatternType.SUBJECT, "invoice"))
                .thenReturn(Optional.of(stored));

        // When
        for (int i = 0; i < 200; i++) {
            patternStore.learn(USER_ID, PatternType.SUBJECT, "invoice", Feedback.POSITIVE, NOW);
        }

        // Then
        assertTrue(stored.getScoreImpact() <= 50.0);
        assertTrue(stored.getScoreImpact() > 49.0);
    }

    @Test
    void loadProfile_ShouldKeySendersByNormalizedAddress() {
        // Given
        VipSender vip = new VipSender();
        vip.setSenderEmail("Boss@Company.com");
        vip.setStatus(VipStatus.ACTIVE);
        SenderReputation reputation = new SenderReputation();
        reputation.setSenderEmail("Friend <FRIEND@example.com>");
        when(preferencesRepository.findById(USER_ID)).thenReturn(Optional.empty());
        when(vipSenderRepository.findByUserIdOrderBySenderEmail(USER_ID)).thenReturn(List.of(vip));
        when(reputationRepository.findByUserId(USER_ID)).thenReturn(List.of(reputation));
        when(patternRepository.findConfident(USER_ID, 0.5, 2)).thenReturn(List.of(stored));

        // When
        ScoringProfile profile = patternStore.loadProfile(USER_ID);

        // Then
        assertSame(vip, profile.getVipSenders().get("boss@company.com"));
        assertSame(reputation, profile.getReputations().get("friend@example.com"));
        assertEquals(List.of(stored), profile.getPatterns());
        assertEquals(80, profile.getPreferences().getHighPriorityThreshold());
    }

    @Test
    void preferences_WithStoredRow_ShouldReturnIt() {
        // Given
        ScoringPreferences preferences = ScoringPreferences.defaults(USER_ID);
        preferences.setHighPriorityThreshold(70);
        when(preferencesRepository.findById(USER_ID)).thenReturn(Optional.of(preferences));

        // When / Then
        assertEquals(70, patternStore.preferences(USER_ID).getHighPriorityThreshold());
    }

    @Test
    void recordVipUsage_ShouldNormalizeSender() {
        // When
        patternStore.recordVipUsage(USER_ID, "Boss <BOSS@company.com>", NOW);

        // Then
        verify(vipSenderRepository).incrementUsage(USER_ID, "boss@company.com", NOW);
        verify(vipSenderRepository, never()).save(any());
    }
}
