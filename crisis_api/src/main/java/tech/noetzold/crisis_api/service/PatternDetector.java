package tech.noetzold.crisis_api.service;

import org.springframework.stereotype.Component;
import tech.noetzold.crisis_api.config.CrisisProperties;
import tech.noetzold.crisis_api.model.PatternAnalysis;
import tech.noetzold.crisis_api.model.RiskLexicon;
import tech.noetzold.crisis_api.model.RiskPattern;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

@Component
public class PatternDetector {

    private final RiskLexicon lexicon;
    private final CrisisProperties props;

    public PatternDetector(RiskLexicon lexicon, CrisisProperties props) {
        this.lexicon = lexicon;
        this.props = props;
    }

    public PatternAnalysis detect(String message) {
        String text = RiskLexicon.normalize(message);

        Map<RiskPattern, Integer> counts = new EnumMap<>(RiskPattern.class);
        Set<RiskPattern> highRisk = EnumSet.noneOf(RiskPattern.class);
        double severity = 0.0;

        for (RiskPattern pattern : RiskPattern.values()) {
            int count = 0;
            if (!text.isEmpty()) {
                for (String phrase : lexicon.terms(pattern)) {
                    if (text.contains(phrase)) count++;
                }
            }
            counts.put(pattern, count);
            severity += count * props.getWeights().of(pattern);
            if (count > 0 && pattern.highRisk()) highRisk.add(pattern);
        }

        return new PatternAnalysis(counts, LexicalCategoryMatcher.clamp(severity), highRisk);
    }
}
