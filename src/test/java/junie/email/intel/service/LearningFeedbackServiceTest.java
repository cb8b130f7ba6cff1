package junie.email.intel.service;

import junie.email.intel.config.LearningProperties;
import junie.email.intel.entity.EmailRecord;
import junie.email.intel.entity.LearnedPattern;
import junie.email.intel.entity.PatternType;
import junie.email.intel.entity.ScoringPreferences;
import junie.email.intel.entity.SenderReputation;
import junie.email.intel.entity.UserAction;
import junie.email.intel.entity.UserActionType;
import junie.email.intel.entity.UserActionType.Feedback;
import junie.email.intel.entity.VipSender;
import junie.email.intel.entity.VipSource;
import junie.email.intel.entity.VipStatus;
import junie.email.intel.model.FeedbackRequest;
import junie.email.intel.model.FeedbackResult;
import junie.email.intel.model.LearningStatistics;
import junie.email.intel.model.PatternUpdate;
import junie.email.intel.model.VipPromotion;
import junie.email.intel.repository.EmailRecordRepository;
import junie.email.intel.repository.EmailScoreRepository;
import junie.email.intel.repository.LearnedPatternRepository;
import junie.email.intel.repository.SenderReputationRepository;
import junie.email.intel.repository.UserActionRepository;
import junie.email.intel.repository.VipSenderRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LearningFeedbackServiceTest {

    private static final String USER_ID = "user123";
    private static final String EMAIL_ID = "email-1";
    private static final String SENDER = "alice@acme.com";
    private static final Instant NOW = Instant.parse("2024-03-11T10:00:00Z");

    @Mock
    private EmailRecordRepository emailRecordRepository;

    @Mock
    private EmailScoreRepository emailScoreRepository;

    @Mock
    private UserActionRepository userActionRepository;

    @Mock
    private SenderReputationRepository reputationRepository;

    @Mock
    private VipSenderRepository vipSenderRepository;

    @Mock
    private LearnedPatternRepository patternRepository;

    @Mock
    private PatternStore patternStore;

    private LearningFeedbackService service;
    private EmailRecord email;

    @BeforeEach
    void setUp() {
        service = new LearningFeedbackService(emailRecordRepository, emailScoreRepository, userActionRepository,
                reputationRepository, vipSenderRepository, patternRepository, patternStore,
                new LearningProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
        email = new EmailRecord();
        email.setId(EMAIL_ID);
        email.setUserId(USER_ID);
        email.setSenderEmail("Alice <Alice@Acme.com>");
        email.setSubject("Quarterly invoice review meeting");
    }

    private void givenStoredEmail() {
        when(emailRecordRepository.findByIdAndUserId(EMAIL_ID, USER_ID)).thenReturn(Optional.of(email));
        when(emailScoreRepository.findByEmailRecordIdAndUserId(EMAIL_ID, USER_ID)).thenReturn(Optional.empty());
        when(userActionRepository.save(any(UserAction.class))).thenAnswer(invocation -> {
            UserAction action = invocation.getArgument(0);
            action.setId("action-1");
            return action;
        });
    }

    @Test
    void recordAction_WithStar_ShouldLearnSenderDomainAndSubjectKeywords() {
        // Given
        givenStoredEmail();
        when(patternStore.preferences(USER_ID)).thenReturn(ScoringPreferences.defaults(USER_ID));
        when(reputationRepository.findByUserIdAndSenderEmail(USER_ID, SENDER)).thenReturn(Optional.empty());
        when(vipSenderRepository.findByUserIdAndSenderEmail(USER_ID, SENDER)).thenReturn(Optional.empty());
        when(patternStore.learn(eq(USER_ID), any(PatternType.class), anyString(), eq(Feedback.POSITIVE), eq(NOW)))
                .thenReturn(PatternUpdate.builder().build());

        // When
        FeedbackResult result = service.recordAction(USER_ID, EMAIL_ID,
                FeedbackRequest.builder().action(UserActionType.STAR).build());

        // Then
        assertTrue(result.isLearningApplied());
        assertEquals("action-1", result.getActionId());
        assertEquals(5, result.getPatternUpdates().size());
        verify(patternStore).learn(USER_ID, PatternType.SENDER, SENDER, Feedback.POSITIVE, NOW);
        verify(patternStore).learn(USER_ID, PatternType.DOMAIN, "acme.com", Feedback.POSITIVE, NOW);
        verify(patternStore).learn(USER_ID, PatternType.SUBJECT, "quarterly", Feedback.POSITIVE, NOW);
        verify(patternStore).learn(USER_ID, PatternType.SUBJECT, "invoice", Feedback.POSITIVE, NOW);
        verify(patternStore).learn(USER_ID, PatternType.SUBJECT, "review", Feedback.POSITIVE, NOW);

        ArgumentCaptor<UserAction> actionCaptor = ArgumentCaptor.forClass(UserAction.class);
        verify(userActionRepository).save(actionCaptor.capture());
        assertEquals(Feedback.POSITIVE, actionCaptor.getValue().getFeedback());
        assertEquals(SENDER, actionCaptor.getValue().getSenderEmail());

        ArgumentCaptor<SenderReputation> reputationCaptor = ArgumentCaptor.forClass(SenderReputation.class);
        verify(reputationRepository).save(reputationCaptor.capture());
        assertEquals(1, reputationCaptor.getValue().getPositiveCount());
        assertEquals("acme.com", reputationCaptor.getValue().getSenderDomain());
    }

    @Test
    void recordAction_WithLearningDisabled_ShouldStoreActionOnly() {
        // Given
        givenStoredEmail();
        ScoringPreferences preferences = ScoringPreferences.defaults(USER_ID);
        preferences.setEnablePatternLearning(false);
        when(patternStore.preferences(USER_ID)).thenReturn(preferences);

        // When
        FeedbackResult result = service.recordAction(USER_ID, EMAIL_ID,
                FeedbackRequest.builder().action(UserActionType.ARCHIVE).build());

        // Then
        assertFalse(result.isLearningApplied());
        verify(userActionRepository).save(any(UserAction.class));
        verifyNoInteractions(reputationRepository);
        verify(patternStore, never()).learn(any(), any(), any(), any(), any());
    }

    @Test
    void recordAction_WithMarkRead_ShouldNotTouchPatterns() {
        // Given
        givenStoredEmail();
        when(patternStore.preferences(USER_ID)).thenReturn(ScoringPreferences.defaults(USER_ID));
        when(reputationRepository.findByUserIdAndSenderEmail(USER_ID, SENDER)).thenReturn(Optional.empty());
        when(vipSenderRepository.findByUserIdAndSenderEmail(USER_ID, SENDER)).thenReturn(Optional.empty());

        // When
        FeedbackResult result = service.recordAction(USER_ID, EMAIL_ID,
                FeedbackRequest.builder().action(UserActionType.MARK_READ).build());

        // Then
        assertTrue(result.isLearningApplied());
        assertTrue(result.getPatternUpdates().isEmpty());
        verify(patternStore, never()).learn(any(), any(), any(), any(), any());
        ArgumentCaptor<SenderReputation> reputationCaptor = ArgumentCaptor.forClass(SenderReputation.class);
        verify(reputationRepository).save(reputationCaptor.capture());
        assertEquals(1, reputationCaptor.getValue().getNeutralCount());
        assertEquals(0.0, reputationCaptor.getValue().getVipConfidence(), 1e-9);
    }

    @Test
    void recordAction_WithEnoughPositiveInteractions_ShouldSuggestLearnedVip() {
        // Given
        givenStoredEmail();
        SenderReputation reputation = new SenderReputation();
        reputation.setUserId(USER_ID);
        reputation.setSenderEmail(SENDER);
        reputation.setPositiveCount(4);
        when(patternStore.preferences(USER_ID)).thenReturn(ScoringPreferences.defaults(USER_ID));
        when(reputationRepository.findByUserIdAndSenderEmail(USER_ID, SENDER)).thenReturn(Optional.of(reputation));
        when(vipSenderRepository.findByUserIdAndSenderEmail(USER_ID, SENDER)).thenReturn(Optional.empty());
        when(patternStore.sampleConfidence(5)).thenReturn(0.81);

        // When
        FeedbackResult result = service.recordAction(USER_ID, EMAIL_ID,
                FeedbackRequest.builder().action(UserActionType.REPLY).build());

        // Then
        assertEquals(1, result.getVipPromotions().size());
        VipPromotion promotion = result.getVipPromotions().get(0);
        assertEquals(SENDER, promotion.getSenderEmail());
        assertEquals(VipStatus.SUGGESTED, promotion.getStatus());
        assertEquals(0.81, promotion.getConfidence(), 1e-9);

        ArgumentCaptor<VipSender> vipCaptor = ArgumentCaptor.forClass(VipSender.class);
        verify(vipSenderRepository).save(vipCaptor.capture());
        assertEquals(VipSource.LEARNED, vipCaptor.getValue().getSource());
        assertEquals(25, vipCaptor.getValue().getScoreBoost());
        assertEquals(NOW, vipCaptor.getValue().getCreatedAt());
    }

    @Test
    void recordAction_WithDisabledVip_ShouldNotSuggestAgain() {
        // Given
        givenStoredEmail();
        SenderReputation reputation = new SenderReputation();
        reputation.setSenderEmail(SENDER);
        reputation.setPositiveCount(9);
        VipSender disabled = new VipSender();
        disabled.setSenderEmail(SENDER);
        disabled.setStatus(VipStatus.DISABLED);
        when(patternStore.preferences(USER_ID)).thenReturn(ScoringPreferences.defaults(USER_ID));
        when(reputationRepository.findByUserIdAndSenderEmail(USER_ID, SENDER)).thenReturn(Optional.of(reputation));
        when(vipSenderRepository.findByUserIdAndSenderEmail(USER_ID, SENDER)).thenReturn(Optional.of(disabled));
        when(patternStore.sampleConfidence(10)).thenReturn(0.96);

        // When
        FeedbackResult result = service.recordAction(USER_ID, EMAIL_ID,
                FeedbackRequest.builder().action(UserActionType.STAR).build());

        // Then
        assertTrue(result.getVipPromotions().isEmpty());
        assertEquals(VipStatus.DISABLED, disabled.getStatus());
        assertEquals(0.96, disabled.getConfidenceScore(), 1e-9);
    }

    @Test
    void recordAction_WithVipOn_ShouldActivateManualVip() {
        // Given
        givenStoredEmail();
        when(patternStore.preferences(USER_ID)).thenReturn(ScoringPreferences.defaults(USER_ID));
        when(reputationRepository.findByUserIdAndSenderEmail(USER_ID, SENDER)).thenReturn(Optional.empty());
        when(vipSenderRepository.findByUserIdAndSenderEmail(USER_ID, SENDER)).thenReturn(Optional.empty());

        // When
        service.recordAction(USER_ID, EMAIL_ID, FeedbackRequest.builder().action(UserActionType.VIP_ON).build());

        // Then
        ArgumentCaptor<VipSender> vipCaptor = ArgumentCaptor.forClass(VipSender.class);
        verify(vipSenderRepository).save(vipCaptor.capture());
        assertEquals(VipStatus.ACTIVE, vipCaptor.getValue().getStatus());
        assertEquals(VipSource.MANUAL, vipCaptor.getValue().getSource());
    }

    @Test
    void recordAction_WithCategoryCorrectionWithoutCategory_ShouldThrow() {
        // Given
        FeedbackRequest request = FeedbackRequest.builder().action(UserActionType.CATEGORY_CORRECTION).build();

        // When / Then
        assertThrows(IllegalArgumentException.class, () -> service.recordAction(USER_ID, EMAIL_ID, request));
        verifyNoInteractions(userActionRepository, emailRecordRepository);
    }

    @Test
    void recordAction_WithUnknownEmail_ShouldThrowNotFound() {
        // Given
        when(emailRecordRepository.findByIdAndUserId(EMAIL_ID, USER_ID)).thenReturn(Optional.empty());

        // When / Then
        assertThrows(NotFoundException.class, () -> service.recordAction(USER_ID, EMAIL_ID,
                FeedbackRequest.builder().action(UserActionType.STAR).build()));
        verifyNoInteractions(userActionRepository);
    }

    @Test
    void derivePatterns_ShouldSkipMalformedAndUnknownEntries() {
        // When
        List<Map.Entry<PatternType, String>> patterns = service.derivePatterns("a@b.com", null,
                List.of("subject:Invoice", "bogus", "color:red", ":x", "sender:a@b.com"));

        // Then
        assertEquals(List.of(
                Map.entry(PatternType.SENDER, "a@b.com"),
                Map.entry(PatternType.DOMAIN, "b.com"),
                Map.entry(PatternType.SUBJECT, "invoice")), patterns);
    }

    @Test
    void subjectKeywords_ShouldDropStopWordsAndShortTokens() {
        // When
        List<String> keywords = service.subjectKeywords("RE: Your new invoice for the project");

        // Then
        assertEquals(List.of("invoice", "project"), keywords);
    }

    @Test
    void getStatistics_ShouldAggregateCounts() {
        // Given
        when(userActionRepository.countByUserId(USER_ID)).thenReturn(7L);
        when(userActionRepository.countByAction(USER_ID)).thenReturn(List.of(
                new Object[]{UserActionType.STAR, 4L},
                new Object[]{UserActionType.ARCHIVE, 3L}));
        when(userActionRepository.countByFeedback(USER_ID)).thenReturn(List.<Object[]>of(
                new Object[]{Feedback.POSITIVE, 4L}));
        when(vipSenderRepository.countByUserIdAndStatus(USER_ID, VipStatus.ACTIVE)).thenReturn(2L);
        when(vipSenderRepository.countByUserIdAndStatus(USER_ID, VipStatus.SUGGESTED)).thenReturn(1L);
        when(patternRepository.countByUserId(USER_ID)).thenReturn(12L);
        when(patternRepository.findConfident(USER_ID, 0.5, 2)).thenReturn(List.of(new LearnedPattern()));

        // When
        LearningStatistics statistics = service.getStatistics(USER_ID);

        // Then
        assertEquals(7, statistics.getTotalActions());
        assertEquals(Map.of("STAR", 4L, "ARCHIVE", 3L), statistics.getActionsByType());
        assertEquals(Map.of("POSITIVE", 4L), statistics.getActionsByFeedback());
        assertEquals(2, statistics.getActiveVipSenders());
        assertEquals(1, statistics.getSuggestedVipSenders());
        assertEquals(12, statistics.getLearnedPatterns());
        assertEquals(1, statistics.getConfidentPatterns());
    }
}
