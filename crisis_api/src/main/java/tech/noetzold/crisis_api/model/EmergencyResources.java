package tech.noetzold.crisis_api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record EmergencyResources(
        @JsonProperty("hotlines") List<Hotline> hotlines,
        @JsonProperty("hospitals") List<Hospital> hospitals,
        @JsonProperty("counseling_centers") List<CounselingCenter> counselingCenters,
        @JsonProperty("online_resources") List<OnlineResource> onlineResources,
        @JsonProperty("emergency_contacts") List<EmergencyContact> emergencyContacts
) {
    public EmergencyResources {
        hotlines = hotlines == null ? List.of() : List.copyOf(hotlines);
        hospitals = hospitals == null ? List.of() : List.copyOf(hospitals);
        counselingCenters = counselingCenters == null ? List.of() : List.copyOf(counselingCenters);
        onlineResources = onlineResources == null ? List.of() : List.copyOf(onlineResources);
        emergencyContacts = emergencyContacts == null ? List.of() : List.copyOf(emergencyContacts);
    }
}
