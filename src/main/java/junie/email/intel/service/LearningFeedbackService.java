package junie.email.intel.service;

import junie.email.intel.config.LearningProperties;
import junie.email.intel.entity.EmailRecord;
import junie.email.intel.entity.EmailScore;
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
import junie.email.intel.model.VipPromotion;
import junie.email.intel.repository.EmailRecordRepository;
import junie.email.intel.repository.EmailScoreRepository;
import junie.email.intel.repository.LearnedPatternRepository;
import junie.email.intel.repository.SenderReputationRepository;
import junie.email.intel.repository.UserActionRepository;
import junie.email.intel.repository.VipSenderRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns user actions into learning: sender reputation, VIP suggestions and pattern updates.
 * The action itself is always stored, whether or not the user has learning enabled.
 */
@Slf4j
@Service
public class LearningFeedbackService {
    private final EmailRecordRepository emailRecordRepository;
    private final EmailScoreRepository emailScoreRepository;
    private final UserActionRepository userActionRepository;
    private final SenderReputationRepository reputationRepository;
    private final VipSenderRepository vipSenderRepository;
    private final LearnedPatternRepository patternRepository;
    private final PatternStore patternStore;
    private final LearningProperties properties;
    private final Clock clock;

    public LearningFeedbackService(EmailRecordRepository emailRecordRepository,
                                   EmailScoreRepository emailScoreRepository,
                                   UserActionRepository userActionRepository,
                                   SenderReputationRepository reputationRepository,
                                   VipSenderRepository vipSenderRepository,
                                   LearnedPatternRepository patternRepository,
                                   PatternStore patternStore,
                                   LearningProperties properties,
                                   Clock clock) {
        this.emailRecordRepository = emailRecordRepository;
        this.emailScoreRepository = emailScoreRepository;
        this.userActionRepository = userActionRepository;
        this.reputationRepository = reputationRepository;
        this.vipSenderRepository = vipSenderRepository;
        this.patternRepository = patternRepository;
        this.patternStore = patternStore;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Records an action on a single email and learns from it.
     */
    @Transactional
    public FeedbackResult recordAction(String userId, String emailId, FeedbackRequest request) {
        if (request == null || request.getAction() == null) {
            throw new IllegalArgumentException("action is required");
        }
        if (request.getAction() == UserActionType.CATEGORY_CORRECTION
                && (request.getCorrectedCategory() == null || request.getCorrectedCategory().isBlank())) {
            throw new IllegalArgumentException("correctedCategory is required for CATEGORY_CORRECTION");
        }
        EmailRecord email = emailRecordRepository.findByIdAndUserId(emailId, userId)
                .orElseThrow(() -> new NotFoundException("Email " + emailId + " not found for user " + userId));
        Optional<EmailScore> score = emailScoreRepository.findByEmailRecordIdAndUserId(emailId, userId);
        String sender = SenderAddresses.normalize(email.getSenderEmail());
        Instant now = Instant.now(clock);

        UserAction action = saveAction(userId, emailId, sender, request.getAction(),
                score.map(EmailScore::getFinalScore).orElse(null), request.getSource(), now);

        if (request.getAction() == UserActionType.CATEGORY_CORRECTION) {
            applyCategoryCorrection(userId, sender, score.orElse(null), request.getCorrectedCategory(), now);
        }
        return learn(userId, sender, email.getSubject(), request.getAction(), request.getPatterns(), action, now);
    }

    /**
     * Records an action taken against a sender as a whole, such as a digest unsubscribe.
     */
    @Transactional
    public FeedbackResult recordSenderAction(String userId, String senderEmail, UserActionType actionType, String source) {
        String sender = SenderAddresses.normalize(senderEmail);
        Instant now = Instant.now(clock);
        UserAction action = saveAction(userId, null, sender, actionType, null, source, now);
        return learn(userId, sender, null, actionType, List.of(), action, now);
    }

    @Transactional(readOnly = true)
    public LearningStatistics getStatistics(String userId) {
        Map<String, Long> byType = new LinkedHashMap<>();
        for (Object[] row : userActionRepository.countByAction(userId)) {
            byType.put(String.valueOf(row[0]), ((Number) row[1]).longValue());
        }
        Map<String, Long> byFeedback = new LinkedHashMap<>();
        for (Object[] row : userActionRepository.countByFeedback(userId)) {
            byFeedback.put(String.valueOf(row[0]), ((Number) row[1]).longValue());
        }
        return LearningStatistics.builder()
                .totalActions(userActionRepository.countByUserId(userId))
                .actionsByType(byType)
                .actionsByFeedback(byFeedback)
                .activeVipSenders(vipSenderRepository.countByUserIdAndStatus(userId, VipStatus.ACTIVE))
                .suggestedVipSenders(vipSenderRepository.countByUserIdAndStatus(userId, VipStatus.SUGGESTED))
                .learnedPatterns(patternRepository.countByUserId(userId))
                .confidentPatterns(patternRepository.findConfident(userId,
                        properties.getConfidentPatternThreshold(), properties.getMinPatternSamples()).size())
                .build();
    }

    private FeedbackResult learn(String userId, String sender, String subject, UserActionType actionType,
                                 List<String> contextPatterns, UserAction action, Instant now) {
        FeedbackResult.FeedbackResultBuilder result = FeedbackResult.builder().actionId(action.getId());

        if (actionType == UserActionType.VIP_ON || actionType == UserActionType.VIP_OFF) {
            applyExplicitVip(userId, sender, actionType == UserActionType.VIP_ON, now);
        }

        ScoringPreferences preferences = patternStore.preferences(userId);
        if (!preferences.isEnablePatternLearning()) {
            log.debug("Pattern learning disabled for user {}, stored {} without learning", userId, actionType);
            return result.learningApplied(false).build();
        }

        Feedback feedback = actionType.feedback();
        SenderReputation reputation = updateReputation(userId, sender, feedback, now);
        checkVipPromotion(userId, sender, reputation, preferences, now).ifPresent(result::vipPromotion);

        if (feedback != Feedback.NEUTRAL) {
            for (Map.Entry<PatternType, String> pattern : derivePatterns(sender, subject, contextPatterns)) {
                result.patternUpdate(patternStore.learn(userId, pattern.getKey(), pattern.getValue(), feedback, now));
            }
        }
        return result.learningApplied(true).build();
    }

    private UserAction saveAction(String userId, String emailId, String sender, UserActionType actionType,
                                  Integer emailScore, String source, Instant now) {
        UserAction action = new UserAction();
        action.setUserId(userId);
        action.setEmailRecordId(emailId);
        action.setAction(actionType);
        action.setFeedback(actionType.feedback());
        action.setSenderEmail(sender);
        action.setEmailScore(emailScore);
        action.setSource(source);
        action.setCreatedAt(now);
        return userActionRepository.save(action);
    }

    private SenderReputation updateReputation(String userId, String sender, Feedback feedback, Instant now) {
        SenderReputation reputation = reputationRepository.findByUserIdAndSenderEmail(userId, sender)
                .orElseGet(() -> {
                    SenderReputation created = new SenderReputation();
                    created.setUserId(userId);
                    created.setSenderEmail(sender);
                    created.setSenderDomain(SenderAddresses.domain(sender));
                    return created;
                });
        switch (feedback) {
            case POSITIVE:
                reputation.setPositiveCount(reputation.getPositiveCount() + 1);
                break;
            case NEGATIVE:
                reputation.setNegativeCount(reputation.getNegativeCount() + 1);
                break;
            default:
                reputation.setNeutralCount(reputation.getNeutralCount() + 1);
        }
        int samples = reputation.getSampleCount();
        double positiveShare = (double) reputation.getPositiveCount() / samples;
        reputation.setVipConfidence(patternStore.sampleConfidence(samples) * positiveShare);
        reputation.setLastInteractionAt(now);
        reputationRepository.save(reputation);

        vipSenderRepository.findByUserIdAndSenderEmail(userId, sender).ifPresent(vip -> {
            vip.setConfidenceScore(reputation.getVipConfidence());
            vipSenderRepository.save(vip);
        });
        return reputation;
    }

    /**
     * A sender becomes a VIP suggestion once enough mostly-positive interactions accumulate.
     * Disabled VIPs are never suggested again.
     */
    private Optional<VipPromotion> checkVipPromotion(String userId, String sender, SenderReputation reputation,
                                                     ScoringPreferences preferences, Instant now) {
        if (reputation.getVipConfidence() < properties.getVipPromotionConfidence()
                || reputation.getSampleCount() < properties.getVipMinSamples()) {
            return Optional.empty();
        }
        Optional<VipSender> existing = vipSenderRepository.findByUserIdAndSenderEmail(userId, sender);
        VipStatus status = preferences.isAutoPromoteVip() ? VipStatus.ACTIVE : VipStatus.SUGGESTED;
        VipSender vip;
        if (existing.isEmpty()) {
            vip = new VipSender();
            vip.setUserId(userId);
            vip.setSenderEmail(sender);
            vip.setSenderDomain(SenderAddresses.domain(sender));
            vip.setScoreBoost(properties.getLearnedVipScoreBoost());
            vip.setSource(VipSource.LEARNED);
            vip.setCreatedAt(now);
        } else if (existing.get().getStatus() == VipStatus.SUGGESTED && status == VipStatus.ACTIVE) {
            vip = existing.get();
        } else {
            return Optional.empty();
        }
        vip.setStatus(status);
        vip.setConfidenceScore(reputation.getVipConfidence());
        vipSenderRepository.save(vip);
        log.info("Sender {} promoted to {} VIP for user {} (confidence {})",
                sender, status, userId, reputation.getVipConfidence());
        return Optional.of(new VipPromotion(sender, reputation.getVipConfidence(), status));
    }

    private void applyExplicitVip(String userId, String sender, boolean enable, Instant now) {
        Optional<VipSender> existing = vipSenderRepository.findByUserIdAndSenderEmail(userId, sender);
        if (!enable) {
            existing.ifPresent(vip -> {
                vip.setStatus(VipStatus.DISABLED);
                vipSenderRepository.save(vip);
                log.info("VIP sender {} disabled for user {}", sender, userId);
            });
            return;
        }
        VipSender vip = existing.orElseGet(() -> {
            VipSender created = new VipSender();
            created.setUserId(userId);
            created.setSenderEmail(sender);
            created.setSenderDomain(SenderAddresses.domain(sender));
            created.setScoreBoost(properties.getLearnedVipScoreBoost());
            created.setSource(VipSource.MANUAL);
            created.setCreatedAt(now);
            return created;
        });
        vip.setStatus(VipStatus.ACTIVE);
        vipSenderRepository.save(vip);
        log.info("VIP sender {} activated for user {}", sender, userId);
    }

    private void applyCategoryCorrection(String userId, String sender, EmailScore score, String category, Instant now) {
        String normalized = category.trim().toLowerCase(Locale.ROOT);
        if (score != null) {
            score.setCorrectedCategory(normalized);
            score.setUpdatedAt(now);
            emailScoreRepository.save(score);
        }
        vipSenderRepository.findByUserIdAndSenderEmail(userId, sender).ifPresent(vip -> {
            vip.setAutoCategory(normalized);
            vipSenderRepository.save(vip);
        });
    }

    /**
     * Sender, its domain, up to a few significant subject words, then any explicit
     * {@code type:value} patterns from the request.
     */
    List<Map.Entry<PatternType, String>> derivePatterns(String sender, String subject, List<String> contextPatterns) {
        List<Map.Entry<PatternType, String>> patterns = new ArrayList<>();
        patterns.add(Map.entry(PatternType.SENDER, sender));
        String domain = SenderAddresses.domain(sender);
        if (!domain.isEmpty()) {
            patterns.add(Map.entry(PatternType.DOMAIN, domain));
        }
        for (String keyword : subjectKeywords(subject)) {
            patterns.add(Map.entry(PatternType.SUBJECT, keyword));
        }
        if (contextPatterns != null) {
            for (String raw : contextPatterns) {
                int colon = raw == null ? -1 : raw.indexOf(':');
                if (colon <= 0 || colon == raw.length() - 1) {
                    log.warn("Ignoring malformed pattern '{}', expected type:value", raw);
                    continue;
                }
                try {
                    PatternType type = PatternType.valueOf(raw.substring(0, colon).trim().toUpperCase(Locale.ROOT));
                    Map.Entry<PatternType, String> entry = Map.entry(type, raw.substring(colon + 1).trim().toLowerCase(Locale.ROOT));
                    if (!patterns.contains(entry)) {
                        patterns.add(entry);
                    }
                } catch (IllegalArgumentException e) {
                    log.warn("Ignoring pattern '{}' with unknown type", raw);
                }
            }
        }
        return patterns;
    }

    List<String> subjectKeywords(String subject) {
        if (subject == null || subject.isBlank()) {
            return List.of();
        }
        Set<String> keywords = new LinkedHashSet<>();
        for (String token : subject.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (token.length() >= properties.getMinKeywordLength() && !properties.getStopWords().contains(token)) {
                keywords.add(token);
            }
            if (keywords.size() == properties.getMaxSubjectKeywords()) {
                break;
            }
        }
        return new ArrayList<>(keywords);
    }
}
