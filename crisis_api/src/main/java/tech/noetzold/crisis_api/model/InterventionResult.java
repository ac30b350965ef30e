package tech.noetzold.crisis_api.model;

public record InterventionResult(
        SafetyVerdict verdict,
        CrisisResponse response
) {}
