package tech.noetzold.crisis_api.service;

import org.junit.jupiter.api.Test;
import tech.noetzold.crisis_api.config.CrisisProperties;
import tech.noetzold.crisis_api.model.PatternAnalysis;
import tech.noetzold.crisis_api.model.RiskPattern;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PatternDetectorTest {

    private final PatternDetector detector =
            new PatternDetector(CrisisEngineFixture.lexicon(), new CrisisProperties());

    @Test
    void finalityGoodbyeAndBurdenAreHighRisk() {
        PatternAnalysis p = detector.detect("This is the last time, goodbye forever. I am a burden.");

        assertEquals(1, p.count(RiskPattern.FINALITY_STATEMENT));
        assertEquals(1, p.count(RiskPattern.GOODBYE_MESSAGE));
        assertEquals(1, p.count(RiskPattern.BURDEN_STATEMENT));
        assertEquals(8.0, p.severity(), 1e-9);
        assertEquals(Set.of(RiskPattern.FINALITY_STATEMENT, RiskPattern.GOODBYE_MESSAGE, RiskPattern.BURDEN_STATEMENT),
                p.highRiskPatterns());
    }

    @Test
    void everyPatternIsReportedEvenWithoutHits() {
        PatternAnalysis p = detector.detect("hello there");

        assertEquals(RiskPattern.values().length, p.counts().size());
        assertEquals(0, p.totalHits());
        assertEquals(0.0, p.severity());
        assertTrue(p.highRiskPatterns().isEmpty());
    }

    @Test
    void extremeLanguageIsNotHighRisk() {
        PatternAnalysis p = detector.detect("Everything is always the worst");

        assertEquals(3, p.count(RiskPattern.EXTREME_LANGUAGE));
        assertEquals(3.0, p.severity(), 1e-9);
        assertTrue(p.highRiskPatterns().isEmpty());
    }

    @Test
    void curlyApostropheIsNormalized() {
        PatternAnalysis p = detector.detect("It’s over now");

        assertEquals(1, p.count(RiskPattern.FINALITY_STATEMENT));
    }

    @Test
    void severityIsClampedToTen() {
        PatternAnalysis p = detector.detect(
                "last time, no turning back, it's over, farewell, say goodbye, goodbye forever");

        assertEquals(10.0, p.severity(), 1e-9);
    }
}
