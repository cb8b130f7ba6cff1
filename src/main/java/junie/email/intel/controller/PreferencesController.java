package junie.email.intel.controller;

import junie.email.intel.entity.ScoringPreferences;
import junie.email.intel.model.LearningStatistics;
import junie.email.intel.service.LearningFeedbackService;
import junie.email.intel.service.PreferencesService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/users/{userId}")
public class PreferencesController {
    private final PreferencesService preferencesService;
    private final LearningFeedbackService learningFeedbackService;

    public PreferencesController(PreferencesService preferencesService,
                                 LearningFeedbackService learningFeedbackService) {
        this.preferencesService = preferencesService;
        this.learningFeedbackService = learningFeedbackService;
    }

    @GetMapping("/preferences")
    public ResponseEntity<ScoringPreferences> get(@PathVariable String userId) {
        return ResponseEntity.ok(preferencesService.get(userId));
    }

    @PutMapping("/preferences")
    public ResponseEntity<ScoringPreferences> update(@PathVariable String userId,
                                                     @RequestBody ScoringPreferences preferences) {
        return ResponseEntity.ok(preferencesService.update(userId, preferences));
    }

    @GetMapping("/learning/statistics")
    public ResponseEntity<LearningStatistics> statistics(@PathVariable String userId) {
        return ResponseEntity.ok(learningFeedbackService.getStatistics(userId));
    }
}
