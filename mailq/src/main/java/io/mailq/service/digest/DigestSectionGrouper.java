package io.mailq.service.digest;

import io.mailq.domain.model.DigestSection;
import io.mailq.domain.model.Entity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Buckets enriched entities into digest sections. Every section is present, in display order.
 */
public final class DigestSectionGrouper {
    private static final Logger log = LoggerFactory.getLogger(DigestSectionGrouper.class);

    private DigestSectionGrouper() {}

    public static Map<DigestSection, List<Entity>> group(List<Entity> entities) {
        Map<DigestSection, List<Entity>> sections = new EnumMap<>(DigestSection.class);
        for (DigestSection section : DigestSection.values()) {
            sections.put(section, new ArrayList<>());
        }

        for (Entity entity : entities) {
            DigestSection section = entity.digestSection();
            if (section == null) {
                log.warn("[DigestSectionGrouper] Entity from email {} has no section (not enriched?), using {}",
                    entity.sourceEmailId(), DigestSection.WORTH_KNOWING);
                section = DigestSection.WORTH_KNOWING;
            }
            sections.get(section).add(entity);
        }
        return sections;
    }
}
