package tech.noetzold.crisis_api.service;

import org.junit.jupiter.api.Test;
import tech.noetzold.crisis_api.config.CrisisProperties;
import tech.noetzold.crisis_api.model.CrisisType;

import static org.junit.jupiter.api.Assertions.*;

class CrisisClassifierTest {

    private final CrisisProperties props = new CrisisProperties();
    private final LexicalCategoryMatcher matcher = new LexicalCategoryMatcher(CrisisEngineFixture.lexicon(), props);
    private final PatternDetector detector = new PatternDetector(CrisisEngineFixture.lexicon(), props);
    private final CrisisClassifier classifier = new CrisisClassifier();

    private CrisisType classify(String message) {
        return classifier.classify(matcher.match(message), detector.detect(message));
    }

    @Test
    void suicideOutranksEveryOtherCategory() {
        assertEquals(CrisisType.SUICIDE_RISK, classify("I feel hopeless and alone and I think about suicide"));
    }

    @Test
    void selfHarmOutranksViolence() {
        assertEquals(CrisisType.SELF_HARM_RISK, classify("I want to hurt myself and take revenge"));
    }

    @Test
    void eachCategoryMapsToItsType() {
        assertEquals(CrisisType.VIOLENCE_RISK, classify("I want revenge"));
        assertEquals(CrisisType.MENTAL_HEALTH_EMERGENCY, classify("I keep hearing voices"));
        assertEquals(CrisisType.SUBSTANCE_ABUSE, classify("I have been drinking every night"));
        assertEquals(CrisisType.SEVERE_DEPRESSION, classify("it all feels pointless"));
        assertEquals(CrisisType.SOCIAL_CRISIS, classify("I am so lonely"));
    }

    @Test
    void finalityWithoutCategoriesIsSuicideRisk() {
        assertEquals(CrisisType.SUICIDE_RISK, classify("this is the last time you hear from me"));
        assertEquals(CrisisType.SUICIDE_RISK, classify("farewell, friend"));
    }

    @Test
    void otherPatternsAloneAreEmotionalDistress() {
        assertEquals(CrisisType.EMOTIONAL_DISTRESS, classify("I am worthless"));
        assertEquals(CrisisType.EMOTIONAL_DISTRESS, classify("the weather is nice"));
    }
}
