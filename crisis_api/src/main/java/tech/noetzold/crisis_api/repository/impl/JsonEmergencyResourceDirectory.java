package tech.noetzold.crisis_api.repository.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Repository;
import tech.noetzold.crisis_api.config.CrisisProperties;
import tech.noetzold.crisis_api.model.CounselingCenter;
import tech.noetzold.crisis_api.model.EmergencyContact;
import tech.noetzold.crisis_api.model.EmergencyResources;
import tech.noetzold.crisis_api.model.Hospital;
import tech.noetzold.crisis_api.model.Hotline;
import tech.noetzold.crisis_api.model.OnlineResource;
import tech.noetzold.crisis_api.repository.EmergencyResourceDirectory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

@Slf4j
@Repository
public class JsonEmergencyResourceDirectory implements EmergencyResourceDirectory {

    private final EmergencyResources resources;

    @Autowired
    public JsonEmergencyResourceDirectory(ObjectMapper objectMapper, CrisisProperties props) {
        this(load(objectMapper, props.getResources().getDirectory()));
    }

    public JsonEmergencyResourceDirectory(EmergencyResources resources) {
        this.resources = resources;
        log.info("Emergency resources loaded: {} hotlines, {} hospitals, {} counseling centers",
                resources.hotlines().size(), resources.hospitals().size(), resources.counselingCenters().size());
    }

    static EmergencyResources load(ObjectMapper objectMapper, String location) {
        try (InputStream in = new ClassPathResource(location).getInputStream()) {
            return objectMapper.readValue(in, EmergencyResources.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read emergency resources from " + location, e);
        }
    }

    @Override
    public List<Hotline> hotlines() {
        return resources.hotlines();
    }

    @Override
    public List<Hospital> hospitals() {
        return resources.hospitals();
    }

    @Override
    public List<CounselingCenter> counselingCenters() {
        return resources.counselingCenters();
    }

    @Override
    public List<OnlineResource> onlineResources() {
        return resources.onlineResources();
    }

    @Override
    public List<EmergencyContact> emergencyContacts() {
        return resources.emergencyContacts();
    }
}
