package junie.email.intel.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Inbound message as handed over by provider ingestion.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmailRecordInput {
    private String providerMessageId;
    private String threadId;
    private String subject;
    private String senderEmail;
    private String senderName;
    private String snippet;
    private String body;
    private Instant receivedAt;
    private boolean important;
    private boolean starred;
    private boolean unread;
    private boolean hasAttachments;
    @Builder.Default
    private List<String> labels = new ArrayList<>();
}
