package tech.noetzold.crisis_api.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

public record PatternAnalysis(
        Map<RiskPattern, Integer> counts,     // every pattern, zero when absent
        double severity,                      // clamped to [0, 10]
        Set<RiskPattern> highRiskPatterns
) {
    public PatternAnalysis {
        counts = counts == null || counts.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(counts));
        highRiskPatterns = highRiskPatterns == null || highRiskPatterns.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(highRiskPatterns));
    }

    public static PatternAnalysis empty() {
        return new PatternAnalysis(Map.of(), 0.0, Set.of());
    }

    public int count(RiskPattern pattern) {
        return counts.getOrDefault(pattern, 0);
    }

    public int totalHits() {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }
}
