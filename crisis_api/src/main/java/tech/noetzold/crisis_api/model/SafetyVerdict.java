package tech.noetzold.crisis_api.model;

import java.util.List;

public record SafetyVerdict(
        String sessionId,
        int crisisLevel,
        CrisisType crisisType,
        Urgency urgency,
        SafetyIndicators indicators,
        List<String> recommendations,
        boolean requiresIntervention,
        boolean requiresEscalation,
        String language,
        String emotionalState,
        AssessmentStatus status
) {
    public static final int FALLBACK_LEVEL = 8;

    public SafetyVerdict {
        if (crisisLevel < 0 || crisisLevel > 10) {
            throw new IllegalArgumentException("crisis level out of range: " + crisisLevel);
        }
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        indicators = indicators == null ? SafetyIndicators.empty() : indicators;
    }

    /**
     * Verdict returned when detection or aggregation failed. Errs toward caution:
     * level 8, type unknown, urgency high, intervention required.
     */
    public static SafetyVerdict conservativeFallback(String sessionId, String language, List<String> recommendations) {
        return new SafetyVerdict(
                sessionId,
                FALLBACK_LEVEL,
                CrisisType.UNKNOWN,
                Urgency.HIGH,
                SafetyIndicators.empty(),
                recommendations,
                true,
                false,
                language,
                null,
                AssessmentStatus.DEGRADED_FALLBACK
        );
    }

    public boolean fallback() {
        return status == AssessmentStatus.DEGRADED_FALLBACK;
    }
}
