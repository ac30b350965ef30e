package tech.noetzold.crisis_api.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum RiskPattern {

    FINALITY_STATEMENT("finality_statement", 3.0, true),
    GOODBYE_MESSAGE("goodbye_message", 3.0, true),
    EXTREME_LANGUAGE("extreme_language", 1.0, false),
    WORTHLESSNESS("worthlessness", 2.0, false),
    BURDEN_STATEMENT("burden_statement", 2.0, true),
    ISOLATION_EXPRESSION("isolation_expression", 2.0, false);

    private final String code;
    private final double defaultWeight;
    private final boolean highRisk;

    RiskPattern(String code, double defaultWeight, boolean highRisk) {
        this.code = code;
        this.defaultWeight = defaultWeight;
        this.highRisk = highRisk;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public double defaultWeight() {
        return defaultWeight;
    }

    public boolean highRisk() {
        return highRisk;
    }

    public static Optional<RiskPattern> fromCode(String code) {
        if (code == null) return Optional.empty();
        String c = code.trim().toLowerCase();
        return Arrays.stream(values()).filter(v -> v.code.equals(c)).findFirst();
    }

    @Override
    public String toString() {
        return code;
    }
}
