package tech.noetzold.crisis_api.service;

import org.junit.jupiter.api.Test;
import tech.noetzold.crisis_api.config.CrisisProperties;
import tech.noetzold.crisis_api.model.CategoryAnalysis;
import tech.noetzold.crisis_api.model.RiskCategory;

import static org.junit.jupiter.api.Assertions.*;

class LexicalCategoryMatcherTest {

    private final LexicalCategoryMatcher matcher =
            new LexicalCategoryMatcher(CrisisEngineFixture.lexicon(), new CrisisProperties());

    @Test
    void singleSuicideTermCountsWithCategoryWeight() {
        CategoryAnalysis a = matcher.match("I keep thinking about suicide");

        assertTrue(a.matched(RiskCategory.SUICIDE));
        assertEquals(1, a.matches().get(RiskCategory.SUICIDE).count());
        assertEquals(9.0, a.totalSeverity(), 1e-9);
        assertEquals(java.util.Set.of(RiskCategory.SUICIDE), a.highRiskCategories());
    }

    @Test
    void matchingIsCaseInsensitive() {
        CategoryAnalysis a = matcher.match("I feel so LONELY tonight");

        assertTrue(a.matched(RiskCategory.ISOLATION));
        assertTrue(a.highRiskCategories().isEmpty());
    }

    @Test
    void totalSeverityIsClampedToTen() {
        CategoryAnalysis a = matcher.match("I want to die, suicide, I will kill myself");

        assertEquals(3, a.matches().get(RiskCategory.SUICIDE).count());
        assertEquals(27.0, a.matches().get(RiskCategory.SUICIDE).severity(), 1e-9);
        assertEquals(10.0, a.totalSeverity(), 1e-9);
    }

    @Test
    void arabicTermsMatch() {
        CategoryAnalysis a = matcher.match("أشعر أنني أريد أن أموت");

        assertTrue(a.matched(RiskCategory.SUICIDE));
    }

    @Test
    void emptyAndNullMessagesProduceNoMatches() {
        assertTrue(matcher.match("").matches().isEmpty());
        assertTrue(matcher.match(null).matches().isEmpty());
        assertTrue(matcher.match("   ").matches().isEmpty());
    }

    @Test
    void unrelatedMessageHasNoMatches() {
        CategoryAnalysis a = matcher.match("I had a nice lunch with my family today");

        assertTrue(a.matches().isEmpty());
        assertEquals(0.0, a.totalSeverity());
        assertEquals(0, a.termHits());
    }
}
