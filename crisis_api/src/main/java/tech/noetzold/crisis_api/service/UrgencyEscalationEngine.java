package tech.noetzold.crisis_api.service;

import org.springframework.stereotype.Component;
import tech.noetzold.crisis_api.config.CrisisProperties;
import tech.noetzold.crisis_api.model.ContextSignals;
import tech.noetzold.crisis_api.model.CrisisEvent;
import tech.noetzold.crisis_api.model.CrisisType;
import tech.noetzold.crisis_api.model.EscalationAssessment;
import tech.noetzold.crisis_api.model.EscalationCriteria;
import tech.noetzold.crisis_api.model.EscalationTier;
import tech.noetzold.crisis_api.model.ResponseCatalog;
import tech.noetzold.crisis_api.model.Urgency;

import java.util.List;

/**
 * Urgency tier of a single message and escalation decision over the session's trailing
 * events. Nothing is cached: every call recomputes from the history it is given.
 */
@Component
public class UrgencyEscalationEngine {

    private static final int CONTEXT_URGENT_LEVEL = 6;
    private static final int SUSTAINED_WINDOW = 5;
    private static final int SUSTAINED_MIN_HIGH = 3;
    private static final int TREND_WINDOW = 3;
    private static final int TREND_MIN_SUM = 18;
    private static final int FAILED_INTERVENTIONS_AFTER = 2;

    private final CrisisProperties props;
    private final ResponseCatalog catalog;

    public UrgencyEscalationEngine(CrisisProperties props, ResponseCatalog catalog) {
        this.props = props;
        this.catalog = catalog;
    }

    public Urgency urgency(int crisisLevel, CrisisType crisisType, ContextSignals context) {
        CrisisProperties.Thresholds t = props.getThresholds();
        if (crisisLevel >= t.getCritical()) {
            return Urgency.IMMEDIATE;
        }
        if (crisisType.lifeThreatening()) {
            if (crisisLevel >= t.getHigh()) return Urgency.IMMEDIATE;
            if (crisisLevel >= t.getMedium()) return Urgency.URGENT;
        }
        if (context.escalationDetected() && crisisLevel >= CONTEXT_URGENT_LEVEL) {
            return Urgency.URGENT;
        }
        if (crisisLevel >= t.getHigh()) return Urgency.URGENT;
        if (crisisLevel >= t.getMedium()) return Urgency.MODERATE;
        if (crisisLevel >= t.getLow()) return Urgency.LOW;
        return Urgency.NONE;
    }

    /**
     * @param history session events, oldest first, already including the current event when one was recorded
     */
    public EscalationAssessment assess(List<CrisisEvent> history, int currentLevel, String language) {
        CrisisProperties.Thresholds t = props.getThresholds();

        List<CrisisEvent> lastFive = tail(history, SUSTAINED_WINDOW);
        long highCount = lastFive.stream().filter(e -> e.crisisLevel() >= t.getHigh()).count();
        boolean sustained = highCount >= SUSTAINED_MIN_HIGH;

        boolean increasing = false;
        if (history.size() >= TREND_WINDOW) {
            List<CrisisEvent> lastThree = tail(history, TREND_WINDOW);
            int a = lastThree.get(0).crisisLevel();
            int b = lastThree.get(1).crisisLevel();
            int c = lastThree.get(2).crisisLevel();
            increasing = a < b && b < c && (a + b + c) > TREND_MIN_SUM;
        }

        boolean failed = history.size() > FAILED_INTERVENTIONS_AFTER;
        boolean immediate = currentLevel >= t.getCritical();

        EscalationCriteria criteria = new EscalationCriteria(sustained, increasing, failed, immediate);
        boolean needed = immediate
                || (sustained && increasing)
                || (failed && currentLevel >= t.getHigh());

        return new EscalationAssessment(
                needed,
                criteria,
                recommendedAction(criteria, language),
                escalationUrgency(criteria, needed),
                tier(criteria, needed, currentLevel)
        );
    }

    private String recommendedAction(EscalationCriteria c, String language) {
        String key;
        if (c.immediateDanger()) key = "immediate_danger";
        else if (c.sustainedHighRisk()) key = "sustained_high_risk";
        else if (c.increasingSeverity()) key = "increasing_severity";
        else if (c.failedInterventions()) key = "failed_interventions";
        else key = "default";
        return catalog.escalationAction(language, key);
    }

    private Urgency escalationUrgency(EscalationCriteria c, boolean needed) {
        if (c.immediateDanger()) return Urgency.IMMEDIATE;
        if (needed) return Urgency.URGENT;
        if (c.anyMet()) return Urgency.MODERATE;
        return Urgency.NONE;
    }

    private EscalationTier tier(EscalationCriteria c, boolean needed, int currentLevel) {
        if (c.immediateDanger()) return EscalationTier.CRITICAL;
        if (needed) return EscalationTier.HIGH;
        if (c.anyMet()) return EscalationTier.MEDIUM;
        if (currentLevel >= props.getThresholds().getLow()) return EscalationTier.LOW;
        return EscalationTier.NONE;
    }

    private static List<CrisisEvent> tail(List<CrisisEvent> list, int n) {
        return list.subList(Math.max(0, list.size() - n), list.size());
    }
}
