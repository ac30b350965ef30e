package tech.noetzold.crisis_api.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Localized texts used for recommendations, intervention messages and escalation actions.
 * Lookups fall back to English, then to the {@code default} key of the section.
 */
public final class ResponseCatalog {

    public static final String DEFAULT_LANGUAGE = "en";
    private static final String DEFAULT_KEY = "default";

    private final Map<String, ResponseLanguagePack> packs;

    public ResponseCatalog(Map<String, ResponseLanguagePack> packs) {
        if (packs == null || !packs.containsKey(DEFAULT_LANGUAGE)) {
            throw new IllegalArgumentException("response catalog must contain the '" + DEFAULT_LANGUAGE + "' pack");
        }
        this.packs = Map.copyOf(packs);
    }

    public List<String> recommendations(String language, Urgency urgency) {
        return list(pack(language).recommendations(), urgency.code());
    }

    public List<String> immediateActions(String language, String tier) {
        return list(pack(language).immediateActions(), tier);
    }

    public String escalationAction(String language, String criterion) {
        Map<String, String> actions = pack(language).escalationActions();
        return actions.getOrDefault(criterion, actions.getOrDefault(DEFAULT_KEY, ""));
    }

    public List<String> crisisMessages(String language, String template) {
        Map<String, List<String>> messages = pack(language).crisisMessages();
        List<String> variants = messages.get(template);
        if (variants == null || variants.isEmpty()) variants = messages.get("general");
        return variants == null ? List.of() : variants;
    }

    public String culturalSupport(String language, CrisisType crisisType) {
        Map<String, String> support = pack(language).culturalSupport();
        return support.getOrDefault(crisisType.code(), support.getOrDefault(DEFAULT_KEY, ""));
    }

    public Optional<String> coping(String language, String emotion) {
        if (emotion == null) return Optional.empty();
        return Optional.ofNullable(pack(language).coping().get(emotion));
    }

    public List<String> reportRecommendations(String language, String tier) {
        return list(pack(language).reportRecommendations(), tier);
    }

    public boolean supports(String language) {
        return language != null && packs.containsKey(language);
    }

    private ResponseLanguagePack pack(String language) {
        ResponseLanguagePack p = language == null ? null : packs.get(language);
        return p != null ? p : packs.get(DEFAULT_LANGUAGE);
    }

    private static List<String> list(Map<String, List<String>> section, String key) {
        List<String> v = section.get(key);
        if (v == null) v = section.get(DEFAULT_KEY);
        return v == null ? List.of() : v;
    }
}
