package junie.email.intel.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

@Entity
@Table(name = "user_actions")
@Data
public class UserAction {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    private String emailRecordId;

    @Enumerated(EnumType.STRING)
    private UserActionType action;

    @Enumerated(EnumType.STRING)
    private UserActionType.Feedback feedback;

    private String senderEmail;

    private Integer emailScore;

    // "email", "digest" ...
    private String source;

    private Instant createdAt;
}
