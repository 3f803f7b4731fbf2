package io.mailq.domain.model;

import java.time.Instant;

/**
 * Provenance of an extracted entity.
 *
 * @param emailId   source email id
 * @param threadId  mail thread id, blank when unknown
 * @param subject   email subject
 * @param snippet   email snippet
 * @param timestamp when the source email was received, null when unknown
 */
public record EntitySource(
    String emailId,
    String threadId,
    String subject,
    String snippet,
    Instant timestamp
) {
    public EntitySource {
        emailId = emailId != null ? emailId : "";
        threadId = threadId != null ? threadId : "";
        subject = subject != null ? subject : "";
        snippet = snippet != null ? snippet : "";
    }

    public boolean hasThread() {
        return !threadId.isBlank();
    }
}
