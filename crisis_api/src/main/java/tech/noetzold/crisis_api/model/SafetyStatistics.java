package tech.noetzold.crisis_api.model;

import java.util.Map;

public record SafetyStatistics(
        int periodDays,
        long totalCrisisEvents,
        long escalatedEvents,
        Map<CrisisType, Long> crisisTypes,
        double escalationRate,
        int activeSessions
) {}
