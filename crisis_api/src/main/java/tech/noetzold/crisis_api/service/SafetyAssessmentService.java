package tech.noetzold.crisis_api.service;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import tech.noetzold.crisis_api.config.CrisisProperties;
import tech.noetzold.crisis_api.model.AssessmentStatus;
import tech.noetzold.crisis_api.model.CategoryAnalysis;
import tech.noetzold.crisis_api.model.ContextSignals;
import tech.noetzold.crisis_api.model.CrisisEvent;
import tech.noetzold.crisis_api.model.CrisisType;
import tech.noetzold.crisis_api.model.EscalationAssessment;
import tech.noetzold.crisis_api.model.PatternAnalysis;
import tech.noetzold.crisis_api.model.ResponseCatalog;
import tech.noetzold.crisis_api.model.SafetyIndicators;
import tech.noetzold.crisis_api.model.SafetyVerdict;
import tech.noetzold.crisis_api.model.Urgency;
import tech.noetzold.crisis_api.repository.CrisisEventStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Entry point of the crisis engine: {@link #analyze} per inbound message and
 * {@link #checkEscalation} on demand.
 *
 * <p>A failure inside detection or aggregation never reaches the caller; it yields the
 * conservative fallback verdict instead. A message without any signal is a normal,
 * zero-risk verdict. Crisis log failures are logged and otherwise ignored.</p>
 */
@Slf4j
@Service
public class SafetyAssessmentService {

    private final LexicalCategoryMatcher categoryMatcher;
    private final PatternDetector patternDetector;
    private final SessionContextTracker tracker;
    private final CrisisAggregator aggregator;
    private final CrisisClassifier classifier;
    private final UrgencyEscalationEngine escalationEngine;
    private final ExternalCrisisAnalyzerClient externalAnalyzer;
    private final LanguageDetector languageDetector;
    private final EmotionHintDetector emotionDetector;
    private final CrisisEventStore eventStore;
    private final ResponseCatalog catalog;
    private final CrisisProperties props;

    public SafetyAssessmentService(LexicalCategoryMatcher categoryMatcher,
                                   PatternDetector patternDetector,
                                   SessionContextTracker tracker,
                                   CrisisAggregator aggregator,
                                   CrisisClassifier classifier,
                                   UrgencyEscalationEngine escalationEngine,
                                   ExternalCrisisAnalyzerClient externalAnalyzer,
                                   LanguageDetector languageDetector,
                                   EmotionHintDetector emotionDetector,
                                   CrisisEventStore eventStore,
                                   ResponseCatalog catalog,
                                   CrisisProperties props) {
        this.categoryMatcher = categoryMatcher;
        this.patternDetector = patternDetector;
        this.tracker = tracker;
        this.aggregator = aggregator;
        this.classifier = classifier;
        this.escalationEngine = escalationEngine;
        this.externalAnalyzer = externalAnalyzer;
        this.languageDetector = languageDetector;
        this.emotionDetector = emotionDetector;
        this.eventStore = eventStore;
        this.catalog = catalog;
        this.props = props;
    }

    public SafetyVerdict analyze(String sessionId, String message) {
        return analyze(sessionId, message, null);
    }

    public SafetyVerdict analyze(String sessionId, String message, String recentEmotionalState) {
        requireSession(sessionId);
        String text = message == null ? "" : message;
        String language = languageDetector.detect(text);

        MDC.put("session_id", sessionId);
        try {
            Optional<Integer> externalLevel = externalAnalyzer.crisisLevel(sessionId, text);

            Assessment assessment;
            try {
                assessment = tracker.withSession(sessionId,
                        state -> assess(state, text, language, recentEmotionalState, externalLevel));
            } catch (RuntimeException e) {
                log.error("Crisis detection failed for session {}, returning conservative verdict", sessionId, e);
                return SafetyVerdict.conservativeFallback(sessionId, language,
                        catalog.recommendations(language, Urgency.HIGH));
            }

            assessment.event().ifPresent(this::appendToLog);
            return assessment.verdict();
        } finally {
            MDC.remove("session_id");
        }
    }

    public EscalationAssessment checkEscalation(String sessionId, int currentCrisisLevel) {
        requireSession(sessionId);
        int level = CrisisAggregator.clampLevel(currentCrisisLevel);
        return tracker.readSession(sessionId,
                        state -> escalationEngine.assess(state.events(), level, state.language()))
                .orElseGet(() -> escalationEngine.assess(loggedEvents(sessionId), level, LanguageDetector.ENGLISH));
    }

    // untracked session: the durable log is the only history, read without opening the session
    private List<CrisisEvent> loggedEvents(String sessionId) {
        try {
            List<CrisisEvent> logged = eventStore.queryRecentEvents(sessionId, props.getHistory().getMaxEvents());
            return logged == null ? List.of() : logged;
        } catch (Exception e) {
            log.warn("Could not read crisis log for session {}, assessing without history", sessionId, e);
            return List.of();
        }
    }

    public boolean endSession(String sessionId) {
        requireSession(sessionId);
        return tracker.endSession(sessionId);
    }

    private Assessment assess(SessionCrisisState state,
                              String text,
                              String language,
                              String recentEmotionalState,
                              Optional<Integer> externalLevel) {
        CategoryAnalysis categories = categoryMatcher.match(text);
        PatternAnalysis patterns = patternDetector.detect(text);
        ContextSignals context = tracker.getContext(state);

        int localLevel = aggregator.aggregate(categories, patterns, context);
        int level = aggregator.fuse(localLevel, externalLevel);
        CrisisType type = classifier.classify(categories, patterns);
        Urgency urgency = escalationEngine.urgency(level, type, context);

        String emotion = normalizeEmotion(recentEmotionalState);
        if (emotion == null) {
            emotion = emotionDetector.detect(text, language);
        }

        CrisisEvent candidate = null;
        List<CrisisEvent> window = new ArrayList<>(state.events());
        if (level >= props.getThresholds().getMedium()) {
            candidate = new CrisisEvent(state.sessionId(), Instant.now(), level, type,
                    categories.matches().keySet(), false);
            window.add(candidate);
        }
        EscalationAssessment escalation = escalationEngine.assess(window, level, language);

        boolean noSignal = categories.matches().isEmpty()
                && patterns.totalHits() == 0
                && externalLevel.map(l -> l == 0).orElse(true);

        SafetyVerdict verdict = new SafetyVerdict(
                state.sessionId(),
                level,
                type,
                urgency,
                new SafetyIndicators(categories, patterns, context, externalLevel.orElse(null)),
                catalog.recommendations(language, urgency),
                level >= props.getThresholds().getHigh() || urgency == Urgency.URGENT || urgency == Urgency.IMMEDIATE,
                escalation.escalationNeeded(),
                language,
                emotion,
                noSignal ? AssessmentStatus.NO_SIGNAL : AssessmentStatus.ASSESSED
        );

        // state is mutated only once everything above succeeded
        tracker.recordTurn(state, emotion, categories.termHits(), language);
        CrisisEvent event = null;
        if (candidate != null) {
            event = candidate.withEscalated(escalation.escalationNeeded());
            tracker.recordEvent(state, event);
            log.info("Crisis event recorded: session={} level={} type={} urgency={} escalate={}",
                    state.sessionId(), level, type, urgency, escalation.escalationNeeded());
        }
        return new Assessment(verdict, Optional.ofNullable(event));
    }

    private void appendToLog(CrisisEvent event) {
        try {
            eventStore.appendEvent(event.sessionId(), event);
        } catch (Exception e) {
            log.warn("Error to persist crisis event for session {}", event.sessionId(), e);
        }
    }

    private static String normalizeEmotion(String emotion) {
        if (emotion == null || emotion.isBlank()) return null;
        return emotion.trim().toLowerCase();
    }

    private static void requireSession(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("session_id is required");
        }
    }

    private record Assessment(SafetyVerdict verdict, Optional<CrisisEvent> event) {}
}
