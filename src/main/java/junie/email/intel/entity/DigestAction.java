package junie.email.intel.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

@Entity
@Table(name = "digest_actions")
@Data
public class DigestAction {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "digest_id", nullable = false)
    private String digestId;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    private DigestActionType actionType;

    @Enumerated(EnumType.STRING)
    private DigestTargetType targetType;

    private String targetValue;

    private int affectedEmails;

    private boolean applied;

    private String note;

    private Instant createdAt;
}
