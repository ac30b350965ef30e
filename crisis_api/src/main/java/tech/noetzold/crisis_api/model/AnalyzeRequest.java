package tech.noetzold.crisis_api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record AnalyzeRequest(
        @JsonProperty("session_id")
        @NotBlank @Size(max = 120)
        String sessionId,
        @JsonProperty("message")
        @NotBlank
        String message,
        @JsonProperty("emotional_state")
        String emotionalState
) {}
