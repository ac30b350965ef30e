package tech.noetzold.crisis_api.model;

public record EscalationAssessment(
        boolean escalationNeeded,
        EscalationCriteria criteriaMet,
        String recommendedAction,
        Urgency urgency,
        EscalationTier tier
) {}
