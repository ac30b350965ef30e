package tech.noetzold.crisis_api.service;

import org.springframework.stereotype.Component;
import tech.noetzold.crisis_api.config.CrisisProperties;
import tech.noetzold.crisis_api.model.CategoryAnalysis;
import tech.noetzold.crisis_api.model.ContextSignals;
import tech.noetzold.crisis_api.model.PatternAnalysis;

import java.util.Optional;

/**
 * Fuses category severity, pattern severity and session context into one crisis level:
 * {@code clamp(0, 10, round(0.5*category + 0.3*pattern + contextBonus))}.
 */
@Component
public class CrisisAggregator {

    private final CrisisProperties props;

    public CrisisAggregator(CrisisProperties props) {
        this.props = props;
    }

    public int aggregate(CategoryAnalysis categories, PatternAnalysis patterns, ContextSignals context) {
        CrisisProperties.Aggregation a = props.getAggregation();
        double score = a.getCategoryFactor() * categories.totalSeverity()
                + a.getPatternFactor() * patterns.severity()
                + contextBonus(categories, context);
        return clampLevel(Math.round(score));
    }

    public double contextBonus(CategoryAnalysis categories, ContextSignals context) {
        CrisisProperties.Aggregation a = props.getAggregation();
        double bonus = 0.0;
        if (context.escalationDetected()) bonus += a.getEscalationBonus();
        if (context.emotionalDeterioration()) bonus += a.getDeteriorationBonus();
        if (context.previousInterventions() > 1) bonus += a.getInterventionsBonus();
        bonus += categories.highRiskCategories().size() * a.getHighRiskCategoryBonus();
        return bonus;
    }

    /**
     * The external estimate can only raise the local level, never lower it.
     */
    public int fuse(int localLevel, Optional<Integer> externalLevel) {
        return externalLevel
                .map(ext -> Math.max(localLevel, clampLevel(ext)))
                .orElse(localLevel);
    }

    static int clampLevel(long value) {
        return (int) Math.max(0, Math.min(10, value));
    }
}
