package tech.noetzold.crisis_api.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.noetzold.crisis_api.config.CrisisProperties;
import tech.noetzold.crisis_api.model.CrisisEvent;
import tech.noetzold.crisis_api.model.CrisisType;
import tech.noetzold.crisis_api.model.EmotionalProgression;
import tech.noetzold.crisis_api.model.HealthStatus;
import tech.noetzold.crisis_api.model.ResponseCatalog;
import tech.noetzold.crisis_api.model.RiskLexicon;
import tech.noetzold.crisis_api.model.SafetyStatistics;
import tech.noetzold.crisis_api.model.SessionSafetyReport;
import tech.noetzold.crisis_api.repository.CrisisEventStore;
import tech.noetzold.crisis_api.repository.EmergencyResourceDirectory;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class SafetyReportService {

    private static final int REPORT_EVENT_LIMIT = 500;
    private static final int RECENT_EMOTIONS = 5;

    private final CrisisEventStore eventStore;
    private final SessionContextTracker tracker;
    private final ResponseCatalog catalog;
    private final RiskLexicon lexicon;
    private final EmergencyResourceDirectory directory;
    private final CrisisProperties props;

    public SessionSafetyReport report(String sessionId) {
        List<CrisisEvent> events = sessionEvents(sessionId);
        String language = tracker.language(sessionId);

        int highest = events.stream().mapToInt(CrisisEvent::crisisLevel).max().orElse(0);
        Set<CrisisType> types = EnumSet.noneOf(CrisisType.class);
        events.forEach(e -> types.add(e.crisisType()));
        int escalated = (int) events.stream().filter(CrisisEvent::escalated).count();
        boolean followUp = !events.isEmpty();

        return new SessionSafetyReport(
                sessionId,
                events.size(),
                highest,
                types,
                escalated,
                emotionalProgression(tracker.emotionTimeline(sessionId)),
                sessionRecommendations(events, highest, language),
                followUp
        );
    }

    public SafetyStatistics statistics(int days) {
        if (days <= 0) {
            throw new IllegalArgumentException("days must be positive");
        }
        Instant since = Instant.now().minus(Duration.ofDays(days));
        List<CrisisEvent> events;
        try {
            events = eventStore.findSince(since);
        } catch (Exception e) {
            log.warn("Could not read crisis events for statistics", e);
            events = List.of();
        }

        Map<CrisisType, Long> byType = new EnumMap<>(CrisisType.class);
        events.forEach(e -> byType.merge(e.crisisType(), 1L, Long::sum));
        long escalated = events.stream().filter(CrisisEvent::escalated).count();
        double rate = events.isEmpty() ? 0.0 : (double) escalated / events.size();

        return new SafetyStatistics(days, events.size(), escalated, byType, rate, tracker.activeSessions());
    }

    public HealthStatus health() {
        return new HealthStatus(
                "healthy",
                lexicon.loadedCategories(),
                directory.hotlines().size(),
                tracker.activeSessions(),
                props.getThresholds().asMap()
        );
    }

    EmotionalProgression emotionalProgression(List<String> emotions) {
        if (emotions.isEmpty()) {
            return EmotionalProgression.noData();
        }
        Map<String, Integer> distribution = new LinkedHashMap<>();
        emotions.forEach(e -> distribution.merge(e, 1, Integer::sum));

        List<String> recent = emotions.subList(Math.max(0, emotions.size() - RECENT_EMOTIONS), emotions.size());
        int negative = (int) recent.stream().filter(EmotionHintDetector::negative).count();
        int positive = (int) recent.stream().filter(EmotionHintDetector::positive).count();
        String trend = positive > negative ? "improving" : negative > positive ? "concerning" : "stable";

        String dominant = distribution.entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .map(Map.Entry::getKey)
                .orElse("neutral");

        return new EmotionalProgression(distribution, negative, positive, trend, dominant);
    }

    private List<String> sessionRecommendations(List<CrisisEvent> events, int highest, String language) {
        if (events.isEmpty()) return catalog.reportRecommendations(language, "safe");
        if (highest >= 8) return catalog.reportRecommendations(language, "severe");
        if (highest >= 6) return catalog.reportRecommendations(language, "elevated");
        return catalog.reportRecommendations(language, "routine");
    }

    private List<CrisisEvent> sessionEvents(String sessionId) {
        try {
            List<CrisisEvent> stored = eventStore.queryRecentEvents(sessionId, REPORT_EVENT_LIMIT);
            if (stored != null && !stored.isEmpty()) {
                return stored;
            }
        } catch (Exception e) {
            log.warn("Could not read crisis log for session {}, using tracked history", sessionId, e);
        }
        return tracker.recentEvents(sessionId);
    }
}
