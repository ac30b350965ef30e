package tech.noetzold.crisis_api.model;

import java.util.Map;

public record HealthStatus(
        String status,
        int crisisKeywordsLoaded,
        int emergencyResourcesLoaded,
        int activeSessionTracking,
        Map<String, Integer> crisisThresholds
) {}
