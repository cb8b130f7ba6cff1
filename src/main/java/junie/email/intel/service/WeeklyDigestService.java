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
import junie.email.intel.entity.WeeklyDigest;
import junie.email.intel.model.BulkActionProposal;
import junie.email.intel.model.DigestActionRequest;
import junie.email.intel.model.DigestActionResult;
import junie.email.intel.model.DigestCategorySummary;
import junie.email.intel.model.DigestContent;
import junie.email.intel.model.UnsubscribeSuggestion;
import junie.email.intel.repository.DigestActionRepository;
import junie.email.intel.repository.EmailScoreRepository;
import junie.email.intel.repository.UserRepository;
import junie.email.intel.repository.WeeklyDigestRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

/**
 * Weekly aggregation of the low-tier emails that were deliberately left unanalysed, with
 * unsubscribe recommendations and bulk action proposals.
 * <p>
 * Generation reads first and writes once: the digest row is upserted in a single transaction
 * at the end, so a cancelled run leaves nothing behind.
 */
@Slf4j
@Service
public class WeeklyDigestService {
    static final String JOB_LOCK = "weekly-digest";
    static final String UNCATEGORIZED = "uncategorized";

    private final EmailScoreRepository emailScoreRepository;
    private final WeeklyDigestRepository digestRepository;
    private final DigestActionRepository digestActionRepository;
    private final UserRepository userRepository;
    private final PatternStore patternStore;
    private final LearningFeedbackService learningFeedbackService;
    private final UnsubscribeConfidenceCalculator confidenceCalculator;
    private final DistributedLockService distributedLockService;
    private final DigestProperties properties;
    private final ScoringProperties scoringProperties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    // Cancellation flag of the weekly job in progress, null when none is running
    private final AtomicReference<AtomicBoolean> currentRun = new AtomicReference<>();

    public WeeklyDigestService(EmailScoreRepository emailScoreRepository,
                               WeeklyDigestRepository digestRepository,
                               DigestActionRepository digestActionRepository,
                               UserRepository userRepository,
                               PatternStore patternStore,
                               LearningFeedbackService learningFeedbackService,
                               UnsubscribeConfidenceCalculator confidenceCalculator,
                               DistributedLockService distributedLockService,
                               DigestProperties properties,
                               ScoringProperties scoringProperties,
                               PlatformTransactionManager transactionManager,
                               Clock clock) {
        this.emailScoreRepository = emailScoreRepository;
        this.digestRepository = digestRepository;
        this.digestActionRepository = digestActionRepository;
        this.userRepository = userRepository;
        this.patternStore = patternStore;
        this.learningFeedbackService = learningFeedbackService;
        this.confidenceCalculator = confidenceCalculator;
        this.distributedLockService = distributedLockService;
        this.properties = properties;
        this.scoringProperties = scoringProperties;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    /**
     * Builds, or returns the stored, digest of the week containing {@code weekStart}.
     * @param force regenerate even if a digest for that week exists
     */
    public WeeklyDigest generate(String userId, LocalDate weekStart, boolean force) {
        return generate(userId, weekStart, force, () -> Thread.currentThread().isInterrupted());
    }

    WeeklyDigest generate(String userId, LocalDate weekStart, boolean force, BooleanSupplier cancelled) {
        LocalDate monday = weekStart.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        if (!force) {
            WeeklyDigest existing = digestRepository.findByUserIdAndWeekStart(userId, monday).orElse(null);
            if (existing != null) {
                log.debug("Digest for user {} week {} already exists, returning it", userId, monday);
                return existing;
            }
        }

        ZoneId zone = ZoneId.of(properties.getZone());
        Instant from = monday.atStartOfDay(zone).toInstant();
        Instant to = monday.plusWeeks(1).atStartOfDay(zone).toInstant();
        List<EmailScore> lowTier = emailScoreRepository.findByTierReceivedBetween(userId, ProcessingTier.LOW, from, to);
        log.info("Building digest for user {} week {}: {} low-priority emails", userId, monday, lowTier.size());

        Set<String> excludedSenders = excludedSenders(userId);
        Set<String> keptDomains = digestActionRepository.findAppliedTargets(userId, DigestActionType.KEEP, DigestTargetType.DOMAIN);

        Map<String, CategoryAccumulator> categories = new TreeMap<>();
        Map<String, SenderAccumulator> senders = new TreeMap<>();
        List<String> failures = new ArrayList<>();
        for (EmailScore score : lowTier) {
            checkCancelled(cancelled, userId, monday);
            try {
                accumulate(score, categories, senders);
            } catch (RuntimeException e) {
                log.warn("Could not aggregate email score {} into digest: {}", score.getId(), e.getMessage());
                failures.add(score.getId() + ": " + e.getMessage());
            }
        }

        DigestContent content = new DigestContent();
        categories.forEach((name, acc) -> content.getCategories().put(name, acc.toSummary()));
        for (SenderAccumulator sender : senders.values()) {
            if (excludedSenders.contains(sender.sender) || keptDomains.contains(sender.domain)) {
                continue;
            }
            double confidence = confidenceCalculator.confidence(sender.sender, sender.count, sender.promotional, sender.newsletter);
            UnsubscribeSuggestion suggestion = UnsubscribeSuggestion.builder()
                    .sender(sender.sender)
                    .domain(sender.domain)
                    .category(sender.dominantCategory())
                    .count(sender.count)
                    .confidence(confidence)
                    .build();
            if (confidenceCalculator.isSafe(confidence)) {
                content.getSafeToUnsubscribe().add(suggestion);
            } else if (confidenceCalculator.needsReview(confidence)) {
                content.getNeedsReview().add(suggestion);
            }
        }
        content.setBulkActions(bulkProposals(content, categories));
        content.setFailures(failures);

        int total = lowTier.size() - failures.size();
        BigDecimal savings = BigDecimal.valueOf(properties.getEstimatedCostPerEmailCents())
                .multiply(BigDecimal.valueOf(total))
                .setScale(2, RoundingMode.HALF_UP);

        checkCancelled(cancelled, userId, monday);
        WeeklyDigest digest = upsert(userId, monday, content, total, savings,
                failures.isEmpty() ? DigestStatus.GENERATED : DigestStatus.PARTIAL);
        log.info("Digest {} for user {} week {} {}: {} safe, {} to review, {} bulk proposals",
                digest.getId(), userId, monday, digest.getStatus(), content.getSafeToUnsubscribe().size(),
                content.getNeedsReview().size(), content.getBulkActions().size());
        return digest;
    }

    /**
     * Weekly job over every user with the digest enabled, for the week that just ended.
     */
    @Scheduled(cron = "${digest.cron:0 0 6 * * MON}", zone = "${digest.zone:UTC}")
    public void generateWeeklyDigests() {
        String nodeId = distributedLockService.getNodeId();
        if (!distributedLockService.tryLock(JOB_LOCK, nodeId, properties.getJobLockTtl())) {
            log.info("Weekly digest job already running on another node, skipping");
            return;
        }
        AtomicBoolean cancelled = new AtomicBoolean();
        currentRun.set(cancelled);
        LocalDate lastWeek = LocalDate.now(clock.withZone(ZoneId.of(properties.getZone()))).minusWeeks(1);
        log.info("Weekly digest job started for week of {}", lastWeek);
        try {
            for (User user : userRepository.findAll()) {
                if (cancelled.get()) {
                    log.warn("Weekly digest job cancelled");
                    break;
                }
                ScoringPreferences preferences = patternStore.preferences(user.getId());
                if (!preferences.isEnableWeeklyDigest()) {
                    continue;
                }
                try {
                    generate(user.getId(), lastWeek, false,
                            () -> cancelled.get() || Thread.currentThread().isInterrupted());
                } catch (DigestCancelledException e) {
                    log.warn("Digest for user {} cancelled: {}", user.getId(), e.getMessage());
                    break;
                } catch (Exception e) {
                    log.error("Error generating digest for user {}: {}", user.getId(), e.getMessage(), e);
                }
            }
        } finally {
            currentRun.compareAndSet(cancelled, null);
            distributedLockService.releaseLock(JOB_LOCK, nodeId);
        }
        log.info("Weekly digest job ended");
    }

    /**
     * Asks the weekly job in progress to stop before its next write. Digests already written
     * stay; the one being built is dropped. Has no effect on later runs or on digests
     * generated on request.
     * @return true if a run was in progress
     */
    public boolean requestCancellation() {
        AtomicBoolean run = currentRun.get();
        if (run == null) {
            return false;
        }
        run.set(true);
        log.info("Cancellation requested for the weekly digest job");
        return true;
    }

    @EventListener(ContextClosedEvent.class)
    public void onShutdown() {
        requestCancellation();
    }

    public WeeklyDigest markViewed(String userId, String digestId) {
        WeeklyDigest digest = find(userId, digestId);
        if (digest.getUserViewedAt() == null) {
            digest.setUserViewedAt(Instant.now(clock));
            digest = digestRepository.save(digest);
        }
        return digest;
    }

    /**
     * Applies user decisions taken on a digest. Unsubscribe and keep decisions feed back into
     * learning as negative and positive sender feedback.
     */
    public DigestActionResult executeActions(String userId, String digestId, List<DigestActionRequest> requests) {
        WeeklyDigest digest = find(userId, digestId);
        ScoringPreferences preferences = patternStore.preferences(userId);
        DigestContent content = digest.getContent() != null ? digest.getContent() : new DigestContent();
        Instant now = Instant.now(clock);

        DigestActionResult.DigestActionResultBuilder result = DigestActionResult.builder().digestId(digestId);
        int applied = 0;
        for (DigestActionRequest request : requests) {
            if (request.getAction() == null || request.getTargetType() == null
                    || request.getTargetValue() == null || request.getTargetValue().isBlank()) {
                throw new IllegalArgumentException("action, targetType and targetValue are required");
            }
        }
        for (DigestActionRequest request : requests) {
            DigestAction action = new DigestAction();
            action.setDigestId(digestId);
            action.setUserId(userId);
            action.setActionType(request.getAction());
            action.setTargetType(request.getTargetType());
            action.setTargetValue(normalizeTarget(request));
            action.setCreatedAt(now);

            String refusal = apply(userId, content, request.getAction(), request.getTargetType(),
                    action.getTargetValue(), preferences, action);
            if (refusal == null) {
                action.setApplied(true);
                applied++;
            } else {
                action.setNote(refusal);
                result.skip(request.getAction() + " " + action.getTargetValue() + ": " + refusal);
                log.info("Digest action {} on {} skipped for user {}: {}",
                        request.getAction(), action.getTargetValue(), userId, refusal);
            }
            digestActionRepository.save(action);
        }

        digest.setActionsCompletedAt(now);
        digestRepository.save(digest);
        return result.applied(applied).build();
    }

    // Returns null when applied, otherwise the reason it was not
    private String apply(String userId, DigestContent content, DigestActionType type, DigestTargetType targetType,
                         String target, ScoringPreferences preferences, DigestAction action) {
        switch (type) {
            case UNSUBSCRIBE:
            case KEEP: {
                if (type == DigestActionType.UNSUBSCRIBE && !preferences.isEnableBulkUnsubscribe()) {
                    return "bulk unsubscribe is disabled";
                }
                if (targetType == DigestTargetType.CATEGORY) {
                    return type + " applies to senders or domains";
                }
                List<UnsubscribeSuggestion> matching = suggestionsFor(content, targetType, target);
                List<String> senders = targetType == DigestTargetType.SENDER
                        ? List.of(target)
                        : matching.stream().map(UnsubscribeSuggestion::getSender).distinct().collect(Collectors.toList());
                UserActionType feedback = type == DigestActionType.UNSUBSCRIBE ? UserActionType.UNSUBSCRIBE : UserActionType.KEEP;
                for (String sender : senders) {
                    learningFeedbackService.recordSenderAction(userId, sender, feedback, "digest");
                }
                action.setAffectedEmails(matching.stream().mapToInt(UnsubscribeSuggestion::getCount).sum());
                return null;
            }
            case ARCHIVE:
            case MARK_READ: {
                if (targetType != DigestTargetType.CATEGORY) {
                    return type + " applies to categories";
                }
                DigestCategorySummary summary = content.getCategories().get(target);
                action.setAffectedEmails(summary != null ? summary.getCount() : 0);
                return null;
            }
            default:
                return "unsupported action";
        }
    }

    private List<UnsubscribeSuggestion> suggestionsFor(DigestContent content, DigestTargetType targetType, String target) {
        List<UnsubscribeSuggestion> all = new ArrayList<>(content.getSafeToUnsubscribe());
        all.addAll(content.getNeedsReview());
        return all.stream()
                .filter(s -> targetType == DigestTargetType.SENDER ? target.equals(s.getSender()) : target.equals(s.getDomain()))
                .collect(Collectors.toList());
    }

    private static String normalizeTarget(DigestActionRequest request) {
        String value = request.getTargetValue().trim();
        switch (request.getTargetType()) {
            case SENDER:
                return SenderAddresses.normalize(value);
            case DOMAIN:
            case CATEGORY:
            default:
                return value.toLowerCase(Locale.ROOT);
        }
    }

    private WeeklyDigest find(String userId, String digestId) {
        return digestRepository.findByIdAndUserId(digestId, userId)
                .orElseThrow(() -> new NotFoundException("Digest " + digestId + " not found for user " + userId));
    }

    private Set<String> excludedSenders(String userId) {
        Set<String> excluded = new HashSet<>();
        for (VipSender vip : patternStore.activeVipSenders(userId)) {
            excluded.add(SenderAddresses.normalize(vip.getSenderEmail()));
        }
        excluded.addAll(digestActionRepository.findAppliedTargets(userId, DigestActionType.KEEP, DigestTargetType.SENDER));
        return excluded;
    }

    private void accumulate(EmailScore score, Map<String, CategoryAccumulator> categories,
                            Map<String, SenderAccumulator> senders) {
        EmailRecord email = score.getEmailRecord();
        String sender = SenderAddresses.normalize(email.getSenderEmail());
        if (sender.isEmpty()) {
            throw new IllegalStateException("email " + email.getId() + " has no sender");
        }
        String category = score.getCorrectedCategory() != null ? score.getCorrectedCategory()
                : score.getInferredCategory() != null ? score.getInferredCategory()
                : UNCATEGORIZED;

        categories.computeIfAbsent(category, c -> new CategoryAccumulator(properties.getSampleSubjects()))
                .add(sender, email.getSubject());

        SenderAccumulator acc = senders.computeIfAbsent(sender, SenderAccumulator::new);
        acc.count++;
        acc.categories.merge(category, 1, Integer::sum);
        if (CategoryInferenceStrategy.MARKETING.equals(category)
                || (score.getFactors() != null && score.getFactors().getMarketingPenalty() < 0)
                || KeywordCategoryInference.startsWithAny(SenderAddresses.localPart(sender), scoringProperties.getMarketingSenderPrefixes())) {
            acc.promotional = true;
        }
        if (CategoryInferenceStrategy.NEWSLETTER.equals(category)
                || KeywordCategoryInference.containsAny(SenderAddresses.localPart(sender), scoringProperties.getNewsletterIndicators())) {
            acc.newsletter = true;
        }
    }

    private List<BulkActionProposal> bulkProposals(DigestContent content, Map<String, CategoryAccumulator> categories) {
        List<BulkActionProposal> proposals = new ArrayList<>();

        Map<String, List<UnsubscribeSuggestion>> byDomain = new TreeMap<>();
        List<UnsubscribeSuggestion> suggested = new ArrayList<>(content.getSafeToUnsubscribe());
        suggested.addAll(content.getNeedsReview());
        for (UnsubscribeSuggestion suggestion : suggested) {
            if (!suggestion.getDomain().isEmpty()) {
                byDomain.computeIfAbsent(suggestion.getDomain(), d -> new ArrayList<>()).add(suggestion);
            }
        }
        byDomain.forEach((domain, list) -> {
            if (list.size() >= properties.getBulkDomainMinSenders()) {
                proposals.add(BulkActionProposal.builder()
                        .action(DigestActionType.UNSUBSCRIBE)
                        .targetType(DigestTargetType.DOMAIN)
                        .targetValue(domain)
                        .senders(list.stream().map(UnsubscribeSuggestion::getSender).sorted().collect(Collectors.toList()))
                        .emailCount(list.stream().mapToInt(UnsubscribeSuggestion::getCount).sum())
                        .confidence(round2(list.stream().mapToDouble(UnsubscribeSuggestion::getConfidence).average().orElse(0)))
                        .build());
            }
        });

        categories.forEach((category, acc) -> {
            if (acc.count >= properties.getBulkCategoryMinEmails()) {
                proposals.add(BulkActionProposal.builder()
                        .action(DigestActionType.ARCHIVE)
                        .targetType(DigestTargetType.CATEGORY)
                        .targetValue(category)
                        .senders(new ArrayList<>(acc.senders))
                        .emailCount(acc.count)
                        .confidence(round2(Math.min(1.0, acc.count / (double) (properties.getBulkCategoryMinEmails() * 2))))
                        .build());
            }
        });
        return proposals;
    }

    private WeeklyDigest upsert(String userId, LocalDate monday, DigestContent content, int total,
                                BigDecimal savings, DigestStatus status) {
        try {
            return transactionTemplate.execute(tx -> {
                WeeklyDigest digest = digestRepository.findByUserIdAndWeekStart(userId, monday).orElseGet(WeeklyDigest::new);
                digest.setUserId(userId);
                digest.setWeekStart(monday);
                digest.setWeekEnd(monday.plusDays(6));
                digest.setContent(content);
                digest.setTotalLowPriorityEmails(total);
                digest.setCostSavingsCents(savings);
                digest.setStatus(status);
                digest.setGeneratedAt(Instant.now(clock));
                return digestRepository.save(digest);
            });
        } catch (DataIntegrityViolationException e) {
            log.info("Digest for user {} week {} was written concurrently, returning stored copy", userId, monday);
            return digestRepository.findByUserIdAndWeekStart(userId, monday)
                    .orElseThrow(() -> e);
        }
    }

    private static void checkCancelled(BooleanSupplier cancelled, String userId, LocalDate monday) {
        if (cancelled.getAsBoolean()) {
            throw new DigestCancelledException("Digest generation for user " + userId + " week " + monday + " cancelled");
        }
    }

    private static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    private static class CategoryAccumulator {
        private final int maxSubjects;
        int count;
        final Set<String> senders = new TreeSet<>();
        final List<String> subjects = new ArrayList<>();

        CategoryAccumulator(int maxSubjects) {
            this.maxSubjects = maxSubjects;
        }

        void add(String sender, String subject) {
            count++;
            senders.add(sender);
            if (subject != null && subjects.size() < maxSubjects) {
                subjects.add(subject);
            }
        }

        DigestCategorySummary toSummary() {
            return DigestCategorySummary.builder()
                    .count(count)
                    .senders(new ArrayList<>(senders))
                    .sampleSubjects(new ArrayList<>(subjects))
                    .build();
        }
    }

    private static class SenderAccumulator {
        final String sender;
        final String domain;
        int count;
        boolean promotional;
        boolean newsletter;
        final Map<String, Integer> categories = new LinkedHashMap<>();

        SenderAccumulator(String sender) {
            this.sender = sender;
            this.domain = SenderAddresses.domain(sender);
        }

        String dominantCategory() {
            return categories.entrySet().stream()
                    .max(Map.Entry.comparingByValue())
                    .map(Map.Entry::getKey)
                    .orElse(UNCATEGORIZED);
        }
    }
}
