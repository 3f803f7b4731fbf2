package io.mailq.service.digest;

import io.mailq.domain.model.DigestSection;
import io.mailq.domain.model.Entity;
import io.mailq.service.importance.BridgeDecision;

import java.util.List;
import java.util.Map;

/**
 * Output of one digest run.
 *
 * @param sections  visible, deduplicated entities per section
 * @param hidden    entities dropped as expired
 * @param decisions bridge decision per email, in input order
 */
public record DigestBatch(
    Map<DigestSection, List<Entity>> sections,
    List<Entity> hidden,
    List<BridgeDecision> decisions
) {
    public List<Entity> section(DigestSection section) {
        return sections.getOrDefault(section, List.of());
    }

    public int visibleCount() {
        int count = 0;
        for (List<Entity> entities : sections.values()) {
            count += entities.size();
        }
        return count;
    }
}
