package junie.email.intel.service;

import junie.email.intel.entity.VipSender;
import junie.email.intel.entity.VipSource;
import junie.email.intel.entity.VipStatus;
import junie.email.intel.model.VipSenderRequest;
import junie.email.intel.repository.VipSenderRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Slf4j
@Service
public class VipSenderService {
    private static final int MAX_SCORE_BOOST = 50;

    private final VipSenderRepository vipSenderRepository;
    private final Clock clock;

    public VipSenderService(VipSenderRepository vipSenderRepository, Clock clock) {
        this.vipSenderRepository = vipSenderRepository;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<VipSender> list(String userId) {
        return vipSenderRepository.findByUserIdOrderBySenderEmail(userId);
    }

    /**
     * Creates or updates a VIP by sender address. A manual upsert always marks the entry MANUAL.
     */
    @Transactional
    public VipSender upsert(String userId, VipSenderRequest request) {
        if (request.getScoreBoost() < 0 || request.getScoreBoost() > MAX_SCORE_BOOST) {
            throw new IllegalArgumentException("scoreBoost must be between 0 and " + MAX_SCORE_BOOST);
        }
        String sender = SenderAddresses.normalize(request.getSenderEmail());
        if (sender.isEmpty() || !sender.contains("@")) {
            throw new IllegalArgumentException("senderEmail is not a valid address: " + request.getSenderEmail());
        }
        Instant now = Instant.now(clock);
        VipSender vip = vipSenderRepository.findByUserIdAndSenderEmail(userId, sender).orElseGet(() -> {
            VipSender created = new VipSender();
            created.setUserId(userId);
            created.setSenderEmail(sender);
            created.setSenderDomain(SenderAddresses.domain(sender));
            created.setCreatedAt(now);
            return created;
        });
        vip.setScoreBoost(request.getScoreBoost());
        vip.setAutoCategory(request.getAutoCategory());
        vip.setStatus(request.getStatus() != null ? request.getStatus() : VipStatus.ACTIVE);
        vip.setSource(VipSource.MANUAL);
        VipSender saved = vipSenderRepository.save(vip);
        log.info("VIP sender {} saved for user {} with boost {} ({})", sender, userId, vip.getScoreBoost(), vip.getStatus());
        return saved;
    }

    /**
     * Activates a learned suggestion.
     */
    @Transactional
    public VipSender accept(String userId, String senderEmail) {
        String sender = SenderAddresses.normalize(senderEmail);
        VipSender vip = vipSenderRepository.findByUserIdAndSenderEmail(userId, sender)
                .orElseThrow(() -> new NotFoundException("No VIP suggestion for " + sender));
        if (vip.getStatus() != VipStatus.SUGGESTED) {
            throw new IllegalArgumentException("VIP sender " + sender + " is " + vip.getStatus() + ", not SUGGESTED");
        }
        vip.setStatus(VipStatus.ACTIVE);
        log.info("VIP suggestion {} accepted by user {}", sender, userId);
        return vipSenderRepository.save(vip);
    }
}
