package junie.email.intel.controller;

import junie.email.intel.service.WeeklyDigestService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Control of the scheduled weekly digest job on this node.
 */
@RestController
@RequestMapping("/api/digests/weekly-job")
public class DigestJobController {
    private final WeeklyDigestService weeklyDigestService;

    public DigestJobController(WeeklyDigestService weeklyDigestService) {
        this.weeklyDigestService = weeklyDigestService;
    }

    @PostMapping("/cancel")
    public ResponseEntity<Map<String, Object>> cancel() {
        boolean running = weeklyDigestService.requestCancellation();
        return running
                ? ResponseEntity.accepted().body(Map.of("cancelled", true))
                : ResponseEntity.ok(Map.of("cancelled", false));
    }
}
