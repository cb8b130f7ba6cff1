package junie.email.intel.service;

import junie.email.intel.config.AiInvocationProperties;
import junie.email.intel.entity.AiStatus;
import junie.email.intel.entity.EmailScore;
import junie.email.intel.entity.ProcessingTier;
import junie.email.intel.model.AiInvocationResult;
import junie.email.intel.model.BudgetReservation;
import junie.email.intel.repository.EmailScoreRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Runs AI analysis for scored emails and stores the outcome.
 * <p>
 * High-tier emails are analysed immediately by the caller's thread. Queued emails are drained
 * periodically on the bounded batch executor; each takes its budget reservation right before
 * its own call, so routing decisions made earlier never overspend. A reservation covers the
 * most the call can cost, so concurrent calls overshoot the limit by at most one invocation.
 */
@Slf4j
@Service
public class AnalysisBatchProcessor {
    static final String JOB_LOCK = "ai-batch";
    private static final Duration JOB_LOCK_TTL = Duration.ofMinutes(10);
    // Inline analysis older than this was lost with its request
    static final Duration STALE_IN_PROGRESS = Duration.ofMinutes(15);

    private final EmailScoreRepository emailScoreRepository;
    private final AiInvocationService aiInvocationService;
    private final BudgetService budgetService;
    private final DistributedLockService distributedLockService;
    private final PersistenceRetry persistenceRetry;
    private final AiInvocationProperties properties;
    private final Executor aiBatchExecutor;
    private final Clock clock;

    public AnalysisBatchProcessor(EmailScoreRepository emailScoreRepository,
                                  AiInvocationService aiInvocationService,
                                  BudgetService budgetService,
                                  DistributedLockService distributedLockService,
                                  PersistenceRetry persistenceRetry,
                                  AiInvocationProperties properties,
                                  @Qualifier("aiBatchExecutor") Executor aiBatchExecutor,
                                  Clock clock) {
        this.emailScoreRepository = emailScoreRepository;
        this.aiInvocationService = aiInvocationService;
        this.budgetService = budgetService;
        this.distributedLockService = distributedLockService;
        this.persistenceRetry = persistenceRetry;
        this.properties = properties;
        this.aiBatchExecutor = aiBatchExecutor;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${ai.batch-interval-ms:30000}")
    public void processQueued() {
        String nodeId = distributedLockService.getNodeId();
        if (!distributedLockService.tryLock(JOB_LOCK, nodeId, JOB_LOCK_TTL)) {
            log.debug("AI batch already running on another node, skipping");
            return;
        }
        try {
            requeueStale();
            List<EmailScore> queued = emailScoreRepository.findByAiStatus(AiStatus.QUEUED, PageRequest.of(0, properties.getBatchSize()));
            if (queued.isEmpty()) {
                return;
            }
            log.info("Processing {} queued AI analyses", queued.size());
            List<CompletableFuture<Void>> futures = new ArrayList<>();
            for (EmailScore score : queued) {
                futures.add(CompletableFuture.runAsync(() -> analyzeQueued(score), aiBatchExecutor));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .exceptionally(ex -> {
                    log.error("Error in AI batch processing: {}", ex.getMessage(), ex);
                    return null;
                })
                .join();
        } finally {
            distributedLockService.releaseLock(JOB_LOCK, nodeId);
        }
    }

    /**
     * Analyses a high-tier email now. Its cost is charged even when the budget is spent.
     * If the call fails outright the email goes back to the batch queue.
     */
    public EmailScore analyzeNow(EmailScore score) {
        BudgetReservation reservation = budgetService.forceReserve(score.getUserId(),
                aiInvocationService.reservationCents(score.getEmailRecord()));
        try {
            return analyzeWith(score, reservation);
        } catch (RuntimeException e) {
            if (score.getAiStatus() == AiStatus.IN_PROGRESS) {
                score.setAiStatus(AiStatus.QUEUED);
                score.setUpdatedAt(Instant.now(clock));
                persistenceRetry.execute("Requeue failed analysis", () -> emailScoreRepository.save(score));
            }
            throw e;
        }
    }

    private void requeueStale() {
        Instant cutoff = Instant.now(clock).minus(STALE_IN_PROGRESS);
        List<EmailScore> stale = emailScoreRepository.findByAiStatusAndUpdatedAtBefore(
                AiStatus.IN_PROGRESS, cutoff, PageRequest.of(0, properties.getBatchSize()));
        for (EmailScore score : stale) {
            log.warn("Inline analysis of score {} never finished, queueing it", score.getId());
            score.setAiStatus(AiStatus.QUEUED);
            score.setUpdatedAt(Instant.now(clock));
            persistenceRetry.execute("Requeue stale analysis", () -> emailScoreRepository.save(score));
        }
    }

    void analyzeQueued(EmailScore score) {
        try {
            if (score.getProcessingTier() == ProcessingTier.HIGH) {
                analyzeNow(score);
                return;
            }
            Optional<BudgetReservation> reservation = budgetService.tryReserve(score.getUserId(),
                    aiInvocationService.reservationCents(score.getEmailRecord()));
            if (reservation.isEmpty()) {
                log.info("Budget exhausted for user {}, email {} stays rule-based",
                        score.getUserId(), score.getEmailRecord().getId());
                score.setAiStatus(AiStatus.SKIPPED_BUDGET);
                score.setAiProcessed(false);
                score.setUpdatedAt(Instant.now(clock));
                persistenceRetry.execute("Store skipped analysis", () -> emailScoreRepository.save(score));
                return;
            }
            analyzeWith(score, reservation.get());
        } catch (Exception e) {
            log.error("Error analysing email {}: {}", score.getEmailRecord().getId(), e.getMessage(), e);
        }
    }

    private EmailScore analyzeWith(EmailScore score, BudgetReservation reservation) {
        AiInvocationResult result;
        try {
            result = aiInvocationService.analyze(score.getEmailRecord());
        } catch (RuntimeException e) {
            budgetService.release(reservation);
            throw e;
        }
        budgetService.settle(reservation, result.getChargedCents());
        apply(score, result, Instant.now(clock));
        return persistenceRetry.execute("Store AI analysis", () -> emailScoreRepository.save(score));
    }

    static void apply(EmailScore score, AiInvocationResult result, Instant now) {
        switch (result.getOutcome()) {
            case SUCCESS:
                score.setAiStatus(AiStatus.COMPLETED);
                score.setAiProcessed(true);
                score.setAiAnalysis(result.getAnalysis());
                break;
            case BREAKER_OPEN:
                score.setAiStatus(AiStatus.BREAKER_OPEN);
                score.setAiProcessed(false);
                break;
            case EXHAUSTED:
            default:
                score.setAiStatus(AiStatus.FAILED_FALLBACK);
                score.setAiProcessed(false);
                break;
        }
        score.setUpdatedAt(now);
    }
}
