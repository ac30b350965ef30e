package tech.noetzold.crisis_api.model;

import java.util.List;
import java.util.Set;

public record SessionSafetyReport(
        String sessionId,
        int totalCrisisEvents,
        int highestCrisisLevel,
        Set<CrisisType> crisisTypesEncountered,
        int escalatedEvents,
        EmotionalProgression emotionalProgression,
        List<String> safetyRecommendations,
        boolean followUpRequired
) {}
