package tech.noetzold.crisis_api.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EscalationTier {

    NONE("none"),
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    private final String code;

    EscalationTier(String code) {
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
