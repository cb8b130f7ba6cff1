package junie.email.intel.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

/**
 * Running interaction tally for one sender of one user.
 */
@Entity
@Table(name = "sender_reputations",
        uniqueConstraints = @UniqueConstraint(columnNames = {"user_id", "sender_email"}))
@Data
public class SenderReputation {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "sender_email", nullable = false)
    private String senderEmail;

    private String senderDomain;

    private int positiveCount;
    private int negativeCount;
    private int neutralCount;

    private double vipConfidence;

    private Instant lastInteractionAt;

    public int getSampleCount() {
        return positiveCount + negativeCount + neutralCount;
    }
}
