package tech.noetzold.crisis_api.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CrisisType {

    SUICIDE_RISK("suicide_risk"),
    SELF_HARM_RISK("self_harm_risk"),
    VIOLENCE_RISK("violence_risk"),
    MENTAL_HEALTH_EMERGENCY("mental_health_emergency"),
    SUBSTANCE_ABUSE("substance_abuse"),
    SEVERE_DEPRESSION("severe_depression"),
    SOCIAL_CRISIS("social_crisis"),
    EMOTIONAL_DISTRESS("emotional_distress"),
    // only produced by the conservative fallback verdict
    UNKNOWN("unknown");

    private final String code;

    CrisisType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public boolean lifeThreatening() {
        return this == SUICIDE_RISK || this == VIOLENCE_RISK || this == MENTAL_HEALTH_EMERGENCY;
    }

    public static CrisisType fromCode(String code) {
        for (CrisisType t : values()) {
            if (t.code.equalsIgnoreCase(code)) return t;
        }
        return UNKNOWN;
    }

    @Override
    public String toString() {
        return code;
    }
}
