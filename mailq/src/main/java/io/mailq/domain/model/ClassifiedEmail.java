package io.mailq.domain.model;

import java.util.Optional;

/**
 * Email as seen by the importance mapper: upstream classification plus the text guardrails read.
 *
 * @param id         email id
 * @param subject    subject line (null treated as empty)
 * @param snippet    body snippet (null treated as empty)
 * @param importance raw upstream importance, null when the model gave none
 * @param type       upstream email type (e.g. "notification", "newsletter")
 */
public record ClassifiedEmail(
    String id,
    String subject,
    String snippet,
    String importance,
    String type
) {
    public ClassifiedEmail {
        id = id != null ? id : "unknown";
        subject = subject != null ? subject : "";
        snippet = snippet != null ? snippet : "";
    }

    public Optional<String> rawImportance() {
        return Optional.ofNullable(importance);
    }
}
