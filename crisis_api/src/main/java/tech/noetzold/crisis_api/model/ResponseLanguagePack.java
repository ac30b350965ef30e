package tech.noetzold.crisis_api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

public record ResponseLanguagePack(
        @JsonProperty("recommendations") Map<String, List<String>> recommendations,
        @JsonProperty("immediate_actions") Map<String, List<String>> immediateActions,
        @JsonProperty("escalation_actions") Map<String, String> escalationActions,
        @JsonProperty("crisis_messages") Map<String, List<String>> crisisMessages,
        @JsonProperty("cultural_support") Map<String, String> culturalSupport,
        @JsonProperty("coping") Map<String, String> coping,
        @JsonProperty("report_recommendations") Map<String, List<String>> reportRecommendations
) {
    public ResponseLanguagePack {
        recommendations = recommendations == null ? Map.of() : Map.copyOf(recommendations);
        immediateActions = immediateActions == null ? Map.of() : Map.copyOf(immediateActions);
        escalationActions = escalationActions == null ? Map.of() : Map.copyOf(escalationActions);
        crisisMessages = crisisMessages == null ? Map.of() : Map.copyOf(crisisMessages);
        culturalSupport = culturalSupport == null ? Map.of() : Map.copyOf(culturalSupport);
        coping = coping == null ? Map.of() : Map.copyOf(coping);
        reportRecommendations = reportRecommendations == null ? Map.of() : Map.copyOf(reportRecommendations);
    }
}
