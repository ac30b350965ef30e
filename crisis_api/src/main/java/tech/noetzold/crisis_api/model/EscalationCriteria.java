package tech.noetzold.crisis_api.model;

public record EscalationCriteria(
        boolean sustainedHighRisk,
        boolean increasingSeverity,
        boolean failedInterventions,
        boolean immediateDanger
) {
    public boolean anyMet() {
        return sustainedHighRisk || increasingSeverity || failedInterventions || immediateDanger;
    }
}
