package junie.email.intel.service;

import junie.email.intel.entity.AiStatus;
import junie.email.intel.entity.EmailRecord;
import junie.email.intel.entity.EmailScore;
import junie.email.intel.entity.User;
import junie.email.intel.model.AiDecision;
import junie.email.intel.model.BackfillResult;
import junie.email.intel.model.EmailRecordInput;
import junie.email.intel.model.EmailScoreView;
import junie.email.intel.model.RoutingDecision;
import junie.email.intel.model.ScoreResult;
import junie.email.intel.model.ScoringProfile;
import junie.email.intel.repository.EmailRecordRepository;
import junie.email.intel.repository.EmailScoreRepository;
import junie.email.intel.repository.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Pipeline for one inbound email: validate, store, score, route, and analyse or queue.
 * An email is always scored and stored before any analysis runs.
 */
@Slf4j
@Service
public class EmailIntelligenceService {
    private final EmailRecordValidator validator;
    private final EmailRecordRepository emailRecordRepository;
    private final EmailScoreRepository emailScoreRepository;
    private final UserRepository userRepository;
    private final PatternStore patternStore;
    private final EmailScoringEngine scoringEngine;
    private final TierRouter tierRouter;
    private final AnalysisBatchProcessor analysisProcessor;
    private final PersistenceRetry persistenceRetry;
    private final Executor scoringExecutor;
    private final Clock clock;

    public EmailIntelligenceService(EmailRecordValidator validator,
                                    EmailRecordRepository emailRecordRepository,
                                    EmailScoreRepository emailScoreRepository,
                                    UserRepository userRepository,
                                    PatternStore patternStore,
                                    EmailScoringEngine scoringEngine,
                                    TierRouter tierRouter,
                                    AnalysisBatchProcessor analysisProcessor,
                                    PersistenceRetry persistenceRetry,
                                    @Qualifier("scoringExecutor") Executor scoringExecutor,
                                    Clock clock) {
        this.validator = validator;
        this.emailRecordRepository = emailRecordRepository;
        this.emailScoreRepository = emailScoreRepository;
        this.userRepository = userRepository;
        this.patternStore = patternStore;
        this.scoringEngine = scoringEngine;
        this.tierRouter = tierRouter;
        this.analysisProcessor = analysisProcessor;
        this.persistenceRetry = persistenceRetry;
        this.scoringExecutor = scoringExecutor;
        this.clock = clock;
    }

    /**
     * Scores an inbound email. High-tier mail is analysed before returning; medium-tier mail
     * is queued when budget remains.
     * @throws InvalidEmailRecordException if the record fails validation
     */
    public EmailScoreView scoreEmail(String userId, EmailRecordInput input) {
        return score(userId, input, true);
    }

    /**
     * Scores a batch of historical emails in parallel. Nothing is analysed inline; emails that
     * would be analysed are queued instead.
     */
    public BackfillResult backfill(String userId, List<EmailRecordInput> inputs) {
        log.info("Backfill of {} emails started for user {}", inputs.size(), userId);
        List<CompletableFuture<EmailScoreView>> futures = new ArrayList<>();
        for (EmailRecordInput input : inputs) {
            futures.add(CompletableFuture.supplyAsync(() -> score(userId, input, false), scoringExecutor));
        }

        BackfillResult.BackfillResultBuilder result = BackfillResult.builder();
        int scored = 0;
        int failed = 0;
        for (int i = 0; i < futures.size(); i++) {
            try {
                result.score(futures.get(i).join());
                scored++;
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                String messageId = inputs.get(i) != null ? inputs.get(i).getProviderMessageId() : null;
                log.warn("Backfill of message {} for user {} failed: {}", messageId, userId, cause.getMessage());
                result.error(messageId + ": " + cause.getMessage());
                failed++;
            }
        }
        log.info("Backfill for user {} ended: {} scored, {} failed", userId, scored, failed);
        return result.scored(scored).failed(failed).build();
    }

    public EmailScoreView getScore(String userId, String emailId) {
        EmailScore score = emailScoreRepository.findByEmailRecordIdAndUserId(emailId, userId)
                .orElseThrow(() -> new NotFoundException("No score for email " + emailId));
        return EmailScoreView.of(score, decisionFor(score.getAiStatus()));
    }

    private EmailScoreView score(String userId, EmailRecordInput input, boolean analyzeInline) {
        validator.validate(input);
        ensureUser(userId);
        Instant now = Instant.now(clock);

        EmailRecord record = persistenceRetry.execute("Store email record", () -> upsertRecord(userId, input, now));
        ScoringProfile profile = patternStore.loadProfile(userId);
        ScoreResult result = scoringEngine.score(record, profile, now);
        RoutingDecision decision = tierRouter.route(result.getTier(), userId);

        EmailScore existing = emailScoreRepository.findByEmailRecordIdAndUserId(record.getId(), userId).orElse(null);
        boolean alreadyAnalysed = existing != null && existing.isAiProcessed();
        AiDecision aiDecision = alreadyAnalysed ? AiDecision.INVOKE_NOW : decision.getAiDecision();

        EmailScore score = persistenceRetry.execute("Store email score",
                () -> emailScoreRepository.save(applyScore(existing, record, result, aiDecision, analyzeInline, now)));
        if (result.isVipMatched()) {
            patternStore.recordVipUsage(userId, record.getSenderEmail(), now);
        }
        log.info("Scored email {} for user {}: {} ({}) -> {}",
                record.getId(), userId, result.getFinalScore(), result.getTier(), aiDecision);

        if (!alreadyAnalysed && aiDecision == AiDecision.INVOKE_NOW && analyzeInline) {
            score = analysisProcessor.analyzeNow(score);
        }
        return EmailScoreView.of(score, aiDecision);
    }

    private EmailRecord upsertRecord(String userId, EmailRecordInput input, Instant now) {
        EmailRecord record = emailRecordRepository.findByUserIdAndProviderMessageId(userId, input.getProviderMessageId())
                .orElse(null);
        if (record == null) {
            record = new EmailRecord();
            record.setUserId(userId);
            record.setProviderMessageId(input.getProviderMessageId());
            record.setThreadId(input.getThreadId());
            record.setSubject(input.getSubject());
            record.setSenderEmail(SenderAddresses.normalize(input.getSenderEmail()));
            record.setSenderName(input.getSenderName());
            record.setSnippet(input.getSnippet());
            record.setBody(input.getBody());
            record.setReceivedAt(input.getReceivedAt());
            record.setHasAttachments(input.isHasAttachments());
            record.setIngestedAt(now);
        }
        // Re-ingestion only refreshes provider state
        record.setImportant(input.isImportant());
        record.setStarred(input.isStarred());
        record.setUnread(input.isUnread());
        record.setLabels(new LinkedHashSet<>(input.getLabels() != null ? input.getLabels() : List.of()));
        return emailRecordRepository.save(record);
    }

    private static EmailScore applyScore(EmailScore existing, EmailRecord record, ScoreResult result,
                                         AiDecision decision, boolean analyzeInline, Instant now) {
        EmailScore score = existing;
        if (score == null) {
            score = new EmailScore();
            score.setUserId(record.getUserId());
            score.setEmailRecord(record);
        }
        score.setRawScore(result.getRawScore());
        score.setFinalScore(result.getFinalScore());
        score.setProcessingTier(result.getTier());
        score.setFactors(result.getFactors());
        score.setInferredCategory(result.getInferredCategory());
        score.setScoredAt(now);
        score.setUpdatedAt(now);
        if (!score.isAiProcessed()) {
            score.setAiStatus(initialStatus(decision, analyzeInline));
        }
        return score;
    }

    static AiStatus initialStatus(AiDecision decision, boolean analyzeInline) {
        switch (decision) {
            case INVOKE_NOW:
                // Kept out of the batch queue while this request analyses it
                if (analyzeInline) {
                    return AiStatus.IN_PROGRESS;
                }
                return AiStatus.QUEUED;
            case QUEUE_BATCH:
                return AiStatus.QUEUED;
            case SKIP_BUDGET:
                return AiStatus.SKIPPED_BUDGET;
            case DEFER_DIGEST:
            default:
                return AiStatus.DEFERRED_TO_DIGEST;
        }
    }

    private static AiDecision decisionFor(AiStatus status) {
        if (status == null) {
            return AiDecision.DEFER_DIGEST;
        }
        switch (status) {
            case QUEUED:
                return AiDecision.QUEUE_BATCH;
            case SKIPPED_BUDGET:
                return AiDecision.SKIP_BUDGET;
            case DEFERRED_TO_DIGEST:
                return AiDecision.DEFER_DIGEST;
            default:
                return AiDecision.INVOKE_NOW;
        }
    }

    private void ensureUser(String userId) {
        if (userRepository.existsById(userId)) {
            return;
        }
        User user = new User();
        user.setId(userId);
        user.setCreatedAt(Instant.now(clock));
        try {
            userRepository.save(user);
            log.info("Registered user {}", userId);
        } catch (DataIntegrityViolationException e) {
            log.debug("User {} registered concurrently", userId);
        }
    }
}
