package tech.noetzold.crisis_api.model;

public record SafetyIndicators(
        CategoryAnalysis categoryMatches,
        PatternAnalysis patternMatches,
        ContextSignals contextSignals,
        Integer externalLevel              // null when the external analyzer was not consulted or failed
) {
    public static SafetyIndicators empty() {
        return new SafetyIndicators(CategoryAnalysis.empty(), PatternAnalysis.empty(), ContextSignals.none(), null);
    }
}
