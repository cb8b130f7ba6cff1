package junie.email.intel.controller;

import jakarta.validation.Valid;
import junie.email.intel.entity.VipSender;
import junie.email.intel.model.VipSenderRequest;
import junie.email.intel.service.VipSenderService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/users/{userId}/vip-senders")
public class VipSenderController {
    private final VipSenderService vipSenderService;

    public VipSenderController(VipSenderService vipSenderService) {
        this.vipSenderService = vipSenderService;
    }

    @GetMapping
    public ResponseEntity<List<VipSender>> list(@PathVariable String userId) {
        return ResponseEntity.ok(vipSenderService.list(userId));
    }

    @PutMapping
    public ResponseEntity<VipSender> upsert(@PathVariable String userId, @Valid @RequestBody VipSenderRequest request) {
        return ResponseEntity.ok(vipSenderService.upsert(userId, request));
    }

    /**
     * Turns a learned suggestion into an active VIP.
     */
    @PostMapping("/{senderEmail}/accept")
    public ResponseEntity<VipSender> accept(@PathVariable String userId, @PathVariable String senderEmail) {
        return ResponseEntity.ok(vipSenderService.accept(userId, senderEmail));
    }
}
