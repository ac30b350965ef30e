package tech.noetzold.crisis_api.model;

import java.util.List;

public record CrisisResponse(
        String message,
        int crisisLevel,
        Urgency urgency,
        List<Hotline> resources,           // empty below the high threshold
        List<Hospital> hospitals,
        List<EmergencyContact> emergencyContacts,
        List<CounselingCenter> counselingCenters,   // empty below the medium threshold
        List<OnlineResource> onlineResources,
        List<String> immediateActions,
        boolean followUpRequired
) {}
