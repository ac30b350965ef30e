package tech.noetzold.crisis_api.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum RiskCategory {

    SUICIDE("suicide", 9.0, true),
    SELF_HARM("self_harm", 7.0, true),
    HOPELESSNESS("hopelessness", 2.0, false),
    ISOLATION("isolation", 2.0, false),
    SUBSTANCE_ABUSE("substance_abuse", 2.0, false),
    VIOLENCE("violence", 7.0, true),
    PSYCHOSIS("psychosis", 5.0, false);

    private final String code;
    private final double defaultWeight;
    private final boolean highRisk;

    RiskCategory(String code, double defaultWeight, boolean highRisk) {
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

    /** suicide, self_harm and violence feed the high-risk bonus. */
    public boolean highRisk() {
        return highRisk;
    }

    public static Optional<RiskCategory> fromCode(String code) {
        if (code == null) return Optional.empty();
        String c = code.trim().toLowerCase();
        return Arrays.stream(values()).filter(v -> v.code.equals(c)).findFirst();
    }

    @Override
    public String toString() {
        return code;
    }
}
