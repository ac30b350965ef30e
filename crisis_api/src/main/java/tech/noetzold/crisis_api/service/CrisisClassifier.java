package tech.noetzold.crisis_api.service;

import org.springframework.stereotype.Component;
import tech.noetzold.crisis_api.model.CategoryAnalysis;
import tech.noetzold.crisis_api.model.CrisisType;
import tech.noetzold.crisis_api.model.PatternAnalysis;
import tech.noetzold.crisis_api.model.RiskCategory;
import tech.noetzold.crisis_api.model.RiskPattern;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Picks exactly one crisis type. Order is clinical priority, life-threat first; the first
 * matched category wins, then finality/goodbye patterns, then emotional distress.
 */
@Component
public class CrisisClassifier {

    private static final Map<RiskCategory, CrisisType> PRIORITY = new LinkedHashMap<>();

    static {
        PRIORITY.put(RiskCategory.SUICIDE, CrisisType.SUICIDE_RISK);
        PRIORITY.put(RiskCategory.SELF_HARM, CrisisType.SELF_HARM_RISK);
        PRIORITY.put(RiskCategory.VIOLENCE, CrisisType.VIOLENCE_RISK);
        PRIORITY.put(RiskCategory.PSYCHOSIS, CrisisType.MENTAL_HEALTH_EMERGENCY);
        PRIORITY.put(RiskCategory.SUBSTANCE_ABUSE, CrisisType.SUBSTANCE_ABUSE);
        PRIORITY.put(RiskCategory.HOPELESSNESS, CrisisType.SEVERE_DEPRESSION);
        PRIORITY.put(RiskCategory.ISOLATION, CrisisType.SOCIAL_CRISIS);
    }

    public CrisisType classify(CategoryAnalysis categories, PatternAnalysis patterns) {
        for (Map.Entry<RiskCategory, CrisisType> e : PRIORITY.entrySet()) {
            if (categories.matched(e.getKey())) {
                return e.getValue();
            }
        }
        if (patterns.highRiskPatterns().contains(RiskPattern.FINALITY_STATEMENT)
                || patterns.highRiskPatterns().contains(RiskPattern.GOODBYE_MESSAGE)) {
            return CrisisType.SUICIDE_RISK;
        }
        return CrisisType.EMOTIONAL_DISTRESS;
    }
}
