package tech.noetzold.crisis_api.repository;

import tech.noetzold.crisis_api.model.CounselingCenter;
import tech.noetzold.crisis_api.model.EmergencyContact;
import tech.noetzold.crisis_api.model.Hospital;
import tech.noetzold.crisis_api.model.Hotline;
import tech.noetzold.crisis_api.model.OnlineResource;

import java.util.List;

public interface EmergencyResourceDirectory {

    List<Hotline> hotlines();

    List<Hospital> hospitals();

    List<CounselingCenter> counselingCenters();

    List<OnlineResource> onlineResources();

    List<EmergencyContact> emergencyContacts();
}
