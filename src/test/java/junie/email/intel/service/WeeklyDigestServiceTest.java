package junie.email.intel.service;

import junie.email.intel.config.DigestProperties;
import junie.email.intel.config.ScoringProperties;
import junie.email.intel.entity.DigestAction;
import junie.email.intel.entity.DigestActionType;
import junie.email.intel.entity.DigestStatus;
import junie.email.intel.entity.DigestTargetType;
import junie.email.intel.entity.EmailRecord;
import junie.email.intel.entity.EmailScore;
import junie.email.intel.entity.ProcessingTier;
import junie.email.intel.entity.ScoringPreferences;
import junie.email.intel.entity.User;
import junie.email.intel.entity.UserActionType;
import junie.email.intel.entity.VipSender;
import junie.email.intel.entity.VipStatus;
import junie.email.intel.entity.WeeklyDigest;
import junie.email.intel.model.BulkActionProposal;
import junie.email.intel.model.DigestActionRequest;
import junie.email.intel.model.DigestActionResult;
import junie.email.intel.model.DigestContent;
import junie.email.intel.model.UnsubscribeSuggestion;
import junie.email.intel.repository.DigestActionRepository;
import junie.email.intel.repository.EmailScoreRepository;
import junie.email.intel.repository.UserRepository;
import junie.email.intel.repository.WeeklyDigestRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WeeklyDigestServiceTest {

    private static final String USER_ID = "user123";
    private static final LocalDate MONDAY = LocalDate.of(2024, 3, 11);
    private static final Instant FROM = Instant.parse("2024-03-11T00:00:00Z");
    private static final Instant TO = Instant.parse("2024-03-18T00:00:00Z");
    private static final Instant NOW = Instant.parse("2024-03-18T06:00:00Z");

    @Mock
    private EmailScoreRepository emailScoreRepository;

    @Mock
    private WeeklyDigestRepository digestRepository;

    @Mock
    private DigestActionRepository digestActionRepository;

    @Mock
    private UserRepository userRepository;

    @Mock
    private PatternStore patternStore;

    @Mock
    private LearningFeedbackService learningFeedbackService;

    @Mock
    private DistributedLockService distributedLockService;

    @Mock
    private PlatformTransactionManager transactionManager;

    private WeeklyDigestService service;

    @BeforeEach
    void setUp() {
        DigestProperties properties = new DigestProperties();
        service = new WeeklyDigestService(emailScoreRepository, digestRepository, digestActionRepository,
                userRepository, patternStore, learningFeedbackService,
                new UnsubscribeConfidenceCalculator(properties), distributedLockService, properties,
                new ScoringProperties(), transactionManager, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static List<EmailScore> emails(String sender, String category, int count) {
        List<EmailScore> scores = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            EmailRecord record = new EmailRecord();
            record.setId(sender + "-" + i);
            record.setSenderEmail(sender);
            record.setSubject("Subject " + i + " from " + sender);
            EmailScore score = new EmailScore();
            score.setId("score-" + sender + "-" + i);
            score.setEmailRecord(record);
            score.setProcessingTier(ProcessingTier.LOW);
            score.setInferredCategory(category);
            scores.add(score);
        }
        return scores;
    }

    @Test
    void generate_WithLowPriorityWeek_ShouldSuggestUnsubscribesAndSkipProtectedSenders() {
        // Given
        List<EmailScore> lowTier = new ArrayList<>();
        lowTier.addAll(emails("deals@shop.com", "marketing", 10));
        lowTier.addAll(emails("friend@social.com", "social", 3));
        lowTier.addAll(emails("boss@company.com", "work", 1));
        lowTier.addAll(emails("kept@news.com", "newsletter", 1));
        VipSender boss = new VipSender();
        boss.setSenderEmail("boss@company.com");
        boss.setStatus(VipStatus.ACTIVE);

        when(digestRepository.findByUserIdAndWeekStart(USER_ID, MONDAY)).thenReturn(Optional.empty());
        when(emailScoreRepository.findByTierReceivedBetween(USER_ID, ProcessingTier.LOW, FROM, TO)).thenReturn(lowTier);
        when(patternStore.activeVipSenders(USER_ID)).thenReturn(List.of(boss));
        when(digestActionRepository.findAppliedTargets(USER_ID, DigestActionType.KEEP, DigestTargetType.SENDER))
                .thenReturn(Set.of("kept@news.com"));
        when(digestActionRepository.findAppliedTargets(USER_ID, DigestActionType.KEEP, DigestTargetType.DOMAIN))
                .thenReturn(Set.of());
        when(digestRepository.save(any(WeeklyDigest.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // When
        WeeklyDigest digest = service.generate(USER_ID, MONDAY.plusDays(2), false);

        // Then
        assertEquals(MONDAY, digest.getWeekStart());
        assertEquals(MONDAY.plusDays(6), digest.getWeekEnd());
        assertEquals(DigestStatus.GENERATED, digest.getStatus());
        assertEquals(15, digest.getTotalLowPriorityEmails());
        assertEquals(new BigDecimal("4.95"), digest.getCostSavingsCents());

        DigestContent content = digest.getContent();
        assertEquals(1, content.getSafeToUnsubscribe().size());
        UnsubscribeSuggestion safe = content.getSafeToUnsubscribe().get(0);
        assertEquals("deals@shop.com", safe.getSender());
        assertEquals("marketing", safe.getCategory());
        assertEquals(10, safe.getCount());
        assertEquals(1.0, safe.getConfidence(), 1e-9);

        assertEquals(1, content.getNeedsReview().size());
        assertEquals("friend@social.com", content.getNeedsReview().get(0).getSender());
        assertEquals(0.6, content.getNeedsReview().get(0).getConfidence(), 1e-9);

        assertEquals(10, content.getCategories().get("marketing").getCount());
        assertEquals(5, content.getCategories().get("marketing").getSampleSubjects().size());
        assertEquals(1, content.getCategories().get("work").getCount());

        assertEquals(1, content.getBulkActions().size());
        BulkActionProposal proposal = content.getBulkActions().get(0);
        assertEquals(DigestActionType.ARCHIVE, proposal.getAction());
        assertEquals("marketing", proposal.getTargetValue());
        assertEquals(1.0, proposal.getConfidence(), 1e-9);
    }

    @Test
    void generate_WithExistingDigest_ShouldReturnItUnlessForced() {
        // Given
        WeeklyDigest existing = new WeeklyDigest();
        existing.setId("digest-1");
        when(digestRepository.findByUserIdAndWeekStart(USER_ID, MONDAY)).thenReturn(Optional.of(existing));

        // When
        WeeklyDigest digest = service.generate(USER_ID, MONDAY, false);

        // Then
        assertSame(existing, digest);
        verifyNoInteractions(emailScoreRepository);
        verify(digestRepository, never()).save(any());
    }

    @Test
    void generate_WithForce_ShouldRewriteExistingRow() {
        // Given
        WeeklyDigest existing = new WeeklyDigest();
        existing.setId("digest-1");
        when(digestRepository.findByUserIdAndWeekStart(USER_ID, MONDAY)).thenReturn(Optional.of(existing));
        when(digestRepository.save(any(WeeklyDigest.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // When
        WeeklyDigest digest = service.generate(USER_ID, MONDAY, true);

        // Then
        assertSame(existing, digest);
        assertEquals(0, digest.getTotalLowPriorityEmails());
        assertEquals(NOW, digest.getGeneratedAt());
    }

    @Test
    void generate_WithUnaggregatableEmail_ShouldStorePartialDigest() {
        // Given
        List<EmailScore> lowTier = new ArrayList<>(emails("deals@shop.com", "marketing", 2));
        lowTier.get(1).getEmailRecord().setSenderEmail(null);
        when(digestRepository.findByUserIdAndWeekStart(USER_ID, MONDAY)).thenReturn(Optional.empty());
        when(emailScoreRepository.findByTierReceivedBetween(USER_ID, ProcessingTier.LOW, FROM, TO)).thenReturn(lowTier);
        when(digestRepository.save(any(WeeklyDigest.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // When
        WeeklyDigest digest = service.generate(USER_ID, MONDAY, false);

        // Then
        assertEquals(DigestStatus.PARTIAL, digest.getStatus());
        assertEquals(1, digest.getTotalLowPriorityEmails());
        assertEquals(1, digest.getContent().getFailures().size());
    }

    @Test
    void generate_WhenCancelled_ShouldWriteNothing() {
        // When / Then
        assertThrows(DigestCancelledException.class, () -> service.generate(USER_ID, MONDAY, true, () -> true));
        verify(digestRepository, never()).save(any());
        verifyNoInteractions(transactionManager);
    }

    @Test
    void generateWeeklyDigests_WhenCancelledMidRun_ShouldCommitNothingAndLeaveLaterRunsAlone() {
        // Given
        User first = new User();
        first.setId(USER_ID);
        User second = new User();
        second.setId("user456");
        List<Boolean> cancelAccepted = new ArrayList<>();
        when(distributedLockService.getNodeId()).thenReturn("node-1");
        when(distributedLockService.tryLock(eq(WeeklyDigestService.JOB_LOCK), eq("node-1"), any())).thenReturn(true);
        when(userRepository.findAll()).thenReturn(List.of(first, second));
        when(patternStore.preferences(USER_ID)).thenReturn(ScoringPreferences.defaults(USER_ID));
        when(digestRepository.findByUserIdAndWeekStart(USER_ID, MONDAY)).thenReturn(Optional.empty());
        when(emailScoreRepository.findByTierReceivedBetween(USER_ID, ProcessingTier.LOW, FROM, TO))
                .thenAnswer(invocation -> {
                    cancelAccepted.add(service.requestCancellation());
                    return emails("deals@shop.com", "marketing", 3);
                });

        // When
        service.generateWeeklyDigests();

        // Then
        assertEquals(List.of(true), cancelAccepted);
        verify(digestRepository, never()).save(any());
        verifyNoInteractions(transactionManager);
        verify(patternStore, never()).preferences("user456");
        verify(distributedLockService).releaseLock(WeeklyDigestService.JOB_LOCK, "node-1");

        // Given a request after the cancelled run
        when(digestRepository.save(any(WeeklyDigest.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // When
        WeeklyDigest digest = service.generate(USER_ID, MONDAY, false);

        // Then
        assertEquals(List.of(true, false), cancelAccepted);
        assertEquals(DigestStatus.GENERATED, digest.getStatus());
        assertEquals(3, digest.getTotalLowPriorityEmails());
    }

    @Test
    void requestCancellation_WithNoRunInProgress_ShouldReturnFalse() {
        // When / Then
        assertFalse(service.requestCancellation());
    }

    @Test
    void generateWeeklyDigests_WhenLockHeldElsewhere_ShouldSkip() {
        // Given
        when(distributedLockService.getNodeId()).thenReturn("node-1");
        when(distributedLockService.tryLock(eq(WeeklyDigestService.JOB_LOCK), eq("node-1"), any())).thenReturn(false);

        // When
        service.generateWeeklyDigests();

        // Then
        verifyNoInteractions(userRepository);
        verify(distributedLockService, never()).releaseLock(any(), any());
    }

    @Test
    void executeActions_WithDomainUnsubscribe_ShouldRecordNegativeFeedbackPerSender() {
        // Given
        WeeklyDigest digest = digestWithSuggestion();
        when(digestRepository.findByIdAndUserId("digest-1", USER_ID)).thenReturn(Optional.of(digest));
        when(patternStore.preferences(USER_ID)).thenReturn(ScoringPreferences.defaults(USER_ID));
        List<DigestActionRequest> requests = List.of(
                new DigestActionRequest(DigestActionType.UNSUBSCRIBE, DigestTargetType.DOMAIN, "Shop.com"),
                new DigestActionRequest(DigestActionType.ARCHIVE, DigestTargetType.SENDER, "deals@shop.com"));

        // When
        DigestActionResult result = service.executeActions(USER_ID, "digest-1", requests);

        // Then
        assertEquals(1, result.getApplied());
        assertEquals(1, result.getSkipped().size());
        verify(learningFeedbackService).recordSenderAction(USER_ID, "deals@shop.com", UserActionType.UNSUBSCRIBE, "digest");

        ArgumentCaptor<DigestAction> actionCaptor = ArgumentCaptor.forClass(DigestAction.class);
        verify(digestActionRepository, times(2)).save(actionCaptor.capture());
        DigestAction unsubscribe = actionCaptor.getAllValues().get(0);
        assertTrue(unsubscribe.isApplied());
        assertEquals("shop.com", unsubscribe.getTargetValue());
        assertEquals(10, unsubscribe.getAffectedEmails());
        assertFalse(actionCaptor.getAllValues().get(1).isApplied());
        assertEquals(NOW, digest.getActionsCompletedAt());
    }

    @Test
    void executeActions_WithBulkUnsubscribeDisabled_ShouldSkipUnsubscribe() {
        // Given
        WeeklyDigest digest = digestWithSuggestion();
        ScoringPreferences preferences = ScoringPreferences.defaults(USER_ID);
        preferences.setEnableBulkUnsubscribe(false);
        when(digestRepository.findByIdAndUserId("digest-1", USER_ID)).thenReturn(Optional.of(digest));
        when(patternStore.preferences(USER_ID)).thenReturn(preferences);

        // When
        DigestActionResult result = service.executeActions(USER_ID, "digest-1", List.of(
                new DigestActionRequest(DigestActionType.UNSUBSCRIBE, DigestTargetType.SENDER, "deals@shop.com")));

        // Then
        assertEquals(0, result.getApplied());
        assertEquals(List.of("UNSUBSCRIBE deals@shop.com: bulk unsubscribe is disabled"), result.getSkipped());
        verifyNoInteractions(learningFeedbackService);
    }

    @Test
    void executeActions_WithIncompleteRequest_ShouldRejectWholeBatch() {
        // Given
        when(digestRepository.findByIdAndUserId("digest-1", USER_ID)).thenReturn(Optional.of(digestWithSuggestion()));
        when(patternStore.preferences(USER_ID)).thenReturn(ScoringPreferences.defaults(USER_ID));
        List<DigestActionRequest> requests = List.of(
                new DigestActionRequest(DigestActionType.KEEP, DigestTargetType.SENDER, "deals@shop.com"),
                new DigestActionRequest(DigestActionType.KEEP, DigestTargetType.SENDER, " "));

        // When / Then
        assertThrows(IllegalArgumentException.class, () -> service.executeActions(USER_ID, "digest-1", requests));
        verifyNoInteractions(digestActionRepository, learningFeedbackService);
    }

    @Test
    void markViewed_WithUnknownDigest_ShouldThrowNotFound() {
        // Given
        when(digestRepository.findByIdAndUserId("missing", USER_ID)).thenReturn(Optional.empty());

        // When / Then
        assertThrows(NotFoundException.class, () -> service.markViewed(USER_ID, "missing"));
    }

    private static WeeklyDigest digestWithSuggestion() {
        DigestContent content = new DigestContent();
        content.getSafeToUnsubscribe().add(UnsubscribeSuggestion.builder()
                .sender("deals@shop.com")
                .domain("shop.com")
                .category("marketing")
                .count(10)
                .confidence(1.0)
                .build());
        WeeklyDigest digest = new WeeklyDigest();
        digest.setId("digest-1");
        digest.setUserId(USER_ID);
        digest.setContent(content);
        return digest;
    }
}
