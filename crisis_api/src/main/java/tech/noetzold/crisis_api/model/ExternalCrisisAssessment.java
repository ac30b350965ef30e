package tech.noetzold.crisis_api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ExternalCrisisAssessment(
        @JsonProperty("crisis_level") Integer crisisLevel,
        @JsonProperty("indicators") List<String> indicators,
        @JsonProperty("model_version") String modelVersion
) {}
