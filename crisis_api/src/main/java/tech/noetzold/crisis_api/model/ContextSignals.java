package tech.noetzold.crisis_api.model;

public record ContextSignals(
        int repeatedCrisisThemes,
        boolean escalationDetected,
        boolean emotionalDeterioration,
        int previousInterventions
) {
    public static ContextSignals none() {
        return new ContextSignals(0, false, false, 0);
    }
}
