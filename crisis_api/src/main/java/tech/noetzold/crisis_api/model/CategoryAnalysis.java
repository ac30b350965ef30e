package tech.noetzold.crisis_api.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lexical matches of one message against the risk categories.
 *
 * <p>{@code matches} only holds categories with at least one hit; {@code totalSeverity}
 * is already clamped to [0, 10].</p>
 */
public record CategoryAnalysis(
        Map<RiskCategory, CategoryMatch> matches,
        double totalSeverity,
        Set<RiskCategory> highRiskCategories
) {
    public CategoryAnalysis {
        matches = matches == null || matches.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(matches));
        highRiskCategories = highRiskCategories == null || highRiskCategories.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(highRiskCategories));
    }

    public static CategoryAnalysis empty() {
        return new CategoryAnalysis(Map.of(), 0.0, Set.of());
    }

    public boolean matched(RiskCategory category) {
        return matches.containsKey(category);
    }

    public int termHits() {
        return matches.values().stream().mapToInt(CategoryMatch::count).sum();
    }
}
