package junie.email.intel.controller;

import junie.email.intel.model.BackfillResult;
import junie.email.intel.model.EmailRecordInput;
import junie.email.intel.model.EmailScoreView;
import junie.email.intel.model.FeedbackRequest;
import junie.email.intel.model.FeedbackResult;
import junie.email.intel.service.EmailIntelligenceService;
import junie.email.intel.service.LearningFeedbackService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Scoring and feedback endpoints. Ingestion posts each fetched message to {@code /emails/score}.
 */
@RestController
@RequestMapping("/api/users/{userId}/emails")
public class EmailIntelligenceController {
    private final EmailIntelligenceService emailIntelligenceService;
    private final LearningFeedbackService learningFeedbackService;

    public EmailIntelligenceController(
            EmailIntelligenceService emailIntelligenceService,
            LearningFeedbackService learningFeedbackService) {
        this.emailIntelligenceService = emailIntelligenceService;
        this.learningFeedbackService = learningFeedbackService;
    }

    @PostMapping("/score")
    public ResponseEntity<EmailScoreView> scoreEmail(@PathVariable String userId, @RequestBody EmailRecordInput input) {
        return ResponseEntity.ok(emailIntelligenceService.scoreEmail(userId, input));
    }

    @GetMapping("/{emailId}/score")
    public ResponseEntity<EmailScoreView> getScore(@PathVariable String userId, @PathVariable String emailId) {
        return ResponseEntity.ok(emailIntelligenceService.getScore(userId, emailId));
    }

    @PostMapping("/{emailId}/feedback")
    public ResponseEntity<FeedbackResult> submitFeedback(@PathVariable String userId,
                                                         @PathVariable String emailId,
                                                         @RequestBody FeedbackRequest request) {
        return ResponseEntity.ok(learningFeedbackService.recordAction(userId, emailId, request));
    }

    /**
     * Scores historical mail in bulk. Analysis for these emails happens later in the batch worker.
     */
    @PostMapping("/backfill")
    public ResponseEntity<BackfillResult> backfill(@PathVariable String userId, @RequestBody List<EmailRecordInput> inputs) {
        return ResponseEntity.ok(emailIntelligenceService.backfill(userId, inputs));
    }
}
