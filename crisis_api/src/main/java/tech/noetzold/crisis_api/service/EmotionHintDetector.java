package tech.noetzold.crisis_api.service;

import org.springframework.stereotype.Component;
import tech.noetzold.crisis_api.model.RiskLexicon;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Best-effort emotional state of a message, used when the caller does not supply one.
 */
@Component
public class EmotionHintDetector {

    public static final Set<String> NEGATIVE = Set.of("sad", "anxious", "hopeless", "angry");
    public static final Set<String> POSITIVE = Set.of("happy", "grateful", "hopeful", "calm");

    private static final Map<String, List<String>> LEXICON_EN = new LinkedHashMap<>();
    private static final Map<String, List<String>> LEXICON_AR = new LinkedHashMap<>();

    static {
        LEXICON_EN.put("sad", List.of("sad", "depressed", "down", "hopeless", "miserable"));
        LEXICON_EN.put("anxious", List.of("anxious", "worried", "nervous", "panic", "on edge"));
        LEXICON_EN.put("angry", List.of("angry", "mad", "furious", "irritated"));
        LEXICON_EN.put("stressed", List.of("stressed", "overwhelmed", "burned out", "pressure"));
        LEXICON_EN.put("hopeful", List.of("hopeful", "optimistic", "confident", "grateful", "happy"));

        LEXICON_AR.put("sad", List.of("حزين", "مكتئب", "يائس", "محبط", "بائس"));
        LEXICON_AR.put("anxious", List.of("قلق", "متوتر", "خائف", "مهموم", "مضطرب"));
        LEXICON_AR.put("angry", List.of("غاضب", "معصب", "زعلان", "مستاء"));
        LEXICON_AR.put("stressed", List.of("مضغوط", "مرهق", "منهك", "ضغط"));
        LEXICON_AR.put("hopeful", List.of("متفائل", "أمل", "واثق", "مبسوط", "سعيد"));
    }

    /** Label with the most lexicon hits, or {@code null} when nothing matches. Ties keep the first label. */
    public String detect(String text, String language) {
        String t = RiskLexicon.normalize(text);
        if (t.isEmpty()) return null;
        Map<String, List<String>> lexicon = LanguageDetector.ARABIC.equals(language) ? LEXICON_AR : LEXICON_EN;
        String best = null;
        int bestHits = 0;
        for (Map.Entry<String, List<String>> e : lexicon.entrySet()) {
            int hits = (int) e.getValue().stream().filter(t::contains).count();
            if (hits > bestHits) {
                best = e.getKey();
                bestHits = hits;
            }
        }
        return best;
    }

    public static boolean negative(String emotion) {
        return emotion != null && NEGATIVE.contains(emotion);
    }

    public static boolean positive(String emotion) {
        return emotion != null && POSITIVE.contains(emotion);
    }
}
