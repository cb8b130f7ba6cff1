package junie.email.intel.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

@Entity
@Table(name = "vip_senders",
        uniqueConstraints = @UniqueConstraint(columnNames = {"user_id", "sender_email"}))
@Data
public class VipSender {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "sender_email", nullable = false)
    private String senderEmail;

    private String senderDomain;

    private int scoreBoost; // 0-50

    private String autoCategory;

    private double confidenceScore;

    private int usageCount;

    @Enumerated(EnumType.STRING)
    private VipSource source;

    @Enumerated(EnumType.STRING)
    private VipStatus status;

    private Instant createdAt;

    private Instant lastUsedAt;

    public boolean isActive() {
        return status == VipStatus.ACTIVE;
    }
}
