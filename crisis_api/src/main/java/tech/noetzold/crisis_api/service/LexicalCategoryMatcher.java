package tech.noetzold.crisis_api.service;

import org.springframework.stereotype.Component;
import tech.noetzold.crisis_api.config.CrisisProperties;
import tech.noetzold.crisis_api.model.CategoryAnalysis;
import tech.noetzold.crisis_api.model.CategoryMatch;
import tech.noetzold.crisis_api.model.RiskCategory;
import tech.noetzold.crisis_api.model.RiskLexicon;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Counts risk-category terms in a message. Each term counts once when it occurs as a
 * substring of the normalized text; the category contributes {@code count * weight}.
 */
@Component
public class LexicalCategoryMatcher {

    private final RiskLexicon lexicon;
    private final CrisisProperties props;

    public LexicalCategoryMatcher(RiskLexicon lexicon, CrisisProperties props) {
        this.lexicon = lexicon;
        this.props = props;
    }

    public CategoryAnalysis match(String message) {
        String text = RiskLexicon.normalize(message);
        if (text.isEmpty()) {
            return CategoryAnalysis.empty();
        }

        Map<RiskCategory, CategoryMatch> matches = new EnumMap<>(RiskCategory.class);
        Set<RiskCategory> highRisk = EnumSet.noneOf(RiskCategory.class);
        double total = 0.0;

        for (RiskCategory category : RiskCategory.values()) {
            List<String> hits = new ArrayList<>();
            for (String term : lexicon.terms(category)) {
                if (text.contains(term)) hits.add(term);
            }
            if (hits.isEmpty()) continue;

            double severity = hits.size() * props.getWeights().of(category);
            matches.put(category, new CategoryMatch(hits, hits.size(), severity));
            total += severity;
            if (category.highRisk()) highRisk.add(category);
        }

        return new CategoryAnalysis(matches, clamp(total), highRisk);
    }

    static double clamp(double v) {
        return Math.max(0.0, Math.min(10.0, v));
    }
}
