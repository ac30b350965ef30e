package tech.noetzold.crisis_api.model;

import java.util.Map;

public record EmotionalProgression(
        Map<String, Integer> emotionDistribution,
        int recentNegative,
        int recentPositive,
        String overallTrend,       // improving, concerning, stable, no_data
        String dominantEmotion
) {
    public static EmotionalProgression noData() {
        return new EmotionalProgression(Map.of(), 0, 0, "no_data", "neutral");
    }
}
