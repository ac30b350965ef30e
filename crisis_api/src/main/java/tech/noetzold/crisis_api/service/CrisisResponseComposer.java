package tech.noetzold.crisis_api.service;

import org.springframework.stereotype.Component;
import tech.noetzold.crisis_api.config.CrisisProperties;
import tech.noetzold.crisis_api.model.CounselingCenter;
import tech.noetzold.crisis_api.model.CrisisResponse;
import tech.noetzold.crisis_api.model.CrisisType;
import tech.noetzold.crisis_api.model.EmergencyContact;
import tech.noetzold.crisis_api.model.Hospital;
import tech.noetzold.crisis_api.model.Hotline;
import tech.noetzold.crisis_api.model.OnlineResource;
import tech.noetzold.crisis_api.model.ResponseCatalog;
import tech.noetzold.crisis_api.model.SafetyVerdict;
import tech.noetzold.crisis_api.repository.EmergencyResourceDirectory;

import java.util.List;

@Component
public class CrisisResponseComposer {

    private final ResponseCatalog catalog;
    private final EmergencyResourceDirectory directory;
    private final PhraseSelector phraseSelector;
    private final CrisisProperties props;

    public CrisisResponseComposer(ResponseCatalog catalog,
                                  EmergencyResourceDirectory directory,
                                  PhraseSelector phraseSelector,
                                  CrisisProperties props) {
        this.catalog = catalog;
        this.directory = directory;
        this.phraseSelector = phraseSelector;
        this.props = props;
    }

    public CrisisResponse compose(SafetyVerdict verdict) {
        String language = verdict.language();
        int level = verdict.crisisLevel();
        CrisisProperties.Thresholds t = props.getThresholds();

        StringBuilder message = new StringBuilder()
                .append(phraseSelector.select(catalog.crisisMessages(language, template(verdict.crisisType()))).trim())
                .append("\n\n")
                .append(catalog.culturalSupport(language, verdict.crisisType()).trim());
        if (EmotionHintDetector.negative(verdict.emotionalState())) {
            catalog.coping(language, verdict.emotionalState())
                    .ifPresent(line -> message.append("\n\n").append(line.trim()));
        }

        List<Hotline> hotlines = List.of();
        List<Hospital> hospitals = List.of();
        List<EmergencyContact> contacts = List.of();
        if (level >= t.getHigh()) {
            hotlines = directory.hotlines();
            hospitals = directory.hospitals();
            contacts = directory.emergencyContacts();
        }
        List<CounselingCenter> centers = List.of();
        List<OnlineResource> online = List.of();
        if (level >= t.getMedium()) {
            centers = directory.counselingCenters();
            online = directory.onlineResources();
        }

        return new CrisisResponse(
                message.toString(),
                level,
                verdict.urgency(),
                hotlines,
                hospitals,
                contacts,
                centers,
                online,
                immediateActions(level, language),
                level >= t.getMedium()
        );
    }

    public List<String> immediateActions(int crisisLevel, String language) {
        CrisisProperties.Thresholds t = props.getThresholds();
        String tier;
        if (crisisLevel >= t.getCritical()) tier = "critical";
        else if (crisisLevel >= t.getHigh()) tier = "high";
        else if (crisisLevel >= t.getMedium()) tier = "medium";
        else tier = "default";
        return catalog.immediateActions(language, tier);
    }

    static String template(CrisisType crisisType) {
        return switch (crisisType) {
            case SUICIDE_RISK -> "suicide_ideation";
            case SELF_HARM_RISK -> "self_harm";
            case SUBSTANCE_ABUSE -> "substance_abuse";
            default -> "general";
        };
    }
}
