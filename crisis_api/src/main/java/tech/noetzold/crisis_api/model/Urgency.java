package tech.noetzold.crisis_api.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Urgency {

    NONE("none"),
    LOW("low"),
    MODERATE("moderate"),
    URGENT("urgent"),
    IMMEDIATE("immediate"),
    // fallback-only tier, emitted when detection itself failed
    HIGH("high");

    private final String code;

    Urgency(String code) {
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
