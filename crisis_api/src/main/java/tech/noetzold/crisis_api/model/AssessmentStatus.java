package tech.noetzold.crisis_api.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AssessmentStatus {

    ASSESSED("assessed"),
    NO_SIGNAL("no_signal"),
    DEGRADED_FALLBACK("degraded_fallback");

    private final String code;

    AssessmentStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @Override
    public String toString() {
        return code;
    }
}
