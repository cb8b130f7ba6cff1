package junie.email.intel.controller;

import junie.email.intel.entity.WeeklyDigest;
import junie.email.intel.model.DigestActionRequest;
import junie.email.intel.model.DigestActionResult;
import junie.email.intel.service.WeeklyDigestService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/users/{userId}/digests")
public class DigestController {
    private final WeeklyDigestService weeklyDigestService;
    private final Clock clock;

    public DigestController(WeeklyDigestService weeklyDigestService, Clock clock) {
        this.weeklyDigestService = weeklyDigestService;
        this.clock = clock;
    }

    /**
     * Builds the digest for the week containing {@code weekStart}, the current week if omitted.
     */
    @PostMapping("/weekly")
    public ResponseEntity<WeeklyDigest> generate(
            @PathVariable String userId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate weekStart,
            @RequestParam(defaultValue = "false") boolean force) {
        LocalDate week = weekStart != null ? weekStart : LocalDate.now(clock);
        return ResponseEntity.ok(weeklyDigestService.generate(userId, week, force));
    }

    @GetMapping("/{digestId}")
    public ResponseEntity<WeeklyDigest> view(@PathVariable String userId, @PathVariable String digestId) {
        return ResponseEntity.ok(weeklyDigestService.markViewed(userId, digestId));
    }

    @PostMapping("/{digestId}/actions")
    public ResponseEntity<DigestActionResult> executeActions(@PathVariable String userId,
                                                             @PathVariable String digestId,
                                                             @RequestBody List<DigestActionRequest> actions) {
        return ResponseEntity.ok(weeklyDigestService.executeActions(userId, digestId, actions));
    }
}
