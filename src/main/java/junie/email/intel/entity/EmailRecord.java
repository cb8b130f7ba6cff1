package junie.email.intel.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

@Entity
@Table(name = "email_records",
        uniqueConstraints = @UniqueConstraint(columnNames = {"user_id", "provider_message_id"}))
@Data
public class EmailRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "provider_message_id", nullable = false)
    private String providerMessageId;

    private String threadId;

    @Column(length = 1000)
    private String subject;

    @Column(nullable = false)
    private String senderEmail;

    private String senderName;

    @Column(columnDefinition = "TEXT")
    private String snippet;

    @Column(columnDefinition = "TEXT")
    private String body;

    private Instant receivedAt;

    // Provider flags, refreshed on re-ingestion
    private boolean important;
    private boolean starred;
    private boolean unread;
    private boolean hasAttachments;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "email_record_labels", joinColumns = @JoinColumn(name = "email_record_id"))
    @Column(name = "label")
    private Set<String> labels = new LinkedHashSet<>();

    private Instant ingestedAt;
}
