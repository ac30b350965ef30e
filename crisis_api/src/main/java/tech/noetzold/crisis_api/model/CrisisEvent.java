package tech.noetzold.crisis_api.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

public record CrisisEvent(
        String sessionId,
        Instant timestamp,
        int crisisLevel,
        CrisisType crisisType,
        Set<RiskCategory> contributingCategories,
        boolean escalated
) {
    public CrisisEvent {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(crisisType, "crisisType");
        if (crisisLevel < 0 || crisisLevel > 10) {
            throw new IllegalArgumentException("crisis level out of range: " + crisisLevel);
        }
        timestamp = timestamp == null ? Instant.now() : timestamp;
        contributingCategories = contributingCategories == null || contributingCategories.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(contributingCategories));
    }

    public CrisisEvent withEscalated(boolean value) {
        return new CrisisEvent(sessionId, timestamp, crisisLevel, crisisType, contributingCategories, value);
    }
}
