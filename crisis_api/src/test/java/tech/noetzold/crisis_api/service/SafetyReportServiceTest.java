package tech.noetzold.crisis_api.service;

import org.junit.jupiter.api.Test;
import tech.noetzold.crisis_api.model.CrisisEvent;
import tech.noetzold.crisis_api.model.CrisisType;
import tech.noetzold.crisis_api.model.EmotionalProgression;
import tech.noetzold.crisis_api.model.HealthStatus;
import tech.noetzold.crisis_api.model.SafetyStatistics;
import tech.noetzold.crisis_api.model.SessionSafetyReport;
import tech.noetzold.crisis_api.repository.CrisisEventStore;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class SafetyReportServiceTest {

    private final CrisisEngineFixture fixture = new CrisisEngineFixture();
    private final SafetyReportService reports = fixture.reportService();

    private static CrisisEvent event(String sessionId, Instant at, int level, CrisisType type, boolean escalated) {
        return new CrisisEvent(sessionId, at, level, type, Set.of(), escalated);
    }

    @Test
    void reportSummarizesLoggedEvents() {
        Instant now = Instant.now();
        fixture.store.appendEvent("r1", event("r1", now.minusSeconds(30), 6, CrisisType.SEVERE_DEPRESSION, false));
        fixture.store.appendEvent("r1", event("r1", now.minusSeconds(20), 9, CrisisType.SUICIDE_RISK, true));
        fixture.store.appendEvent("r1", event("r1", now.minusSeconds(10), 5, CrisisType.SUICIDE_RISK, false));

        SessionSafetyReport r = reports.report("r1");

        assertEquals("r1", r.sessionId());
        assertEquals(3, r.totalCrisisEvents());
        assertEquals(9, r.highestCrisisLevel());
        assertEquals(Set.of(CrisisType.SEVERE_DEPRESSION, CrisisType.SUICIDE_RISK), r.crisisTypesEncountered());
        assertEquals(1, r.escalatedEvents());
        assertTrue(r.followUpRequired());
        assertEquals("Arrange immediate follow-up with a mental health professional", r.safetyRecommendations().get(0));
    }

    @Test
    void quietSessionReportIsSafe() {
        SessionSafetyReport r = reports.report("nobody");

        assertEquals(0, r.totalCrisisEvents());
        assertEquals(0, r.highestCrisisLevel());
        assertFalse(r.followUpRequired());
        assertEquals("no_data", r.emotionalProgression().overallTrend());
        assertEquals("No crisis events recorded for this session", r.safetyRecommendations().get(0));
    }

    @Test
    void recommendationTierFollowsHighestLevel() {
        fixture.store.appendEvent("r2", event("r2", Instant.now(), 6, CrisisType.SOCIAL_CRISIS, false));
        assertEquals("Schedule follow-up within 48 hours", reports.report("r2").safetyRecommendations().get(0));

        fixture.store.appendEvent("r3", event("r3", Instant.now(), 5, CrisisType.SOCIAL_CRISIS, false));
        assertEquals("Continue regular check-ins", reports.report("r3").safetyRecommendations().get(0));
    }

    @Test
    void emotionalProgressionTracksRecentTrend() {
        EmotionalProgression concerning = reports.emotionalProgression(List.of("happy", "sad", "sad", "anxious", "calm", "angry"));
        assertEquals("concerning", concerning.overallTrend());
        assertEquals("sad", concerning.dominantEmotion());
        assertEquals(4, concerning.recentNegative());
        assertEquals(1, concerning.recentPositive());
        assertEquals(2, concerning.emotionDistribution().get("sad"));

        EmotionalProgression improving = reports.emotionalProgression(List.of("sad", "calm", "hopeful", "grateful"));
        assertEquals("improving", improving.overallTrend());

        EmotionalProgression stable = reports.emotionalProgression(List.of("stressed", "stressed"));
        assertEquals("stable", stable.overallTrend());
        assertEquals("stressed", stable.dominantEmotion());
    }

    @Test
    void reportUsesTrackedEmotionsOfTheSession() {
        SafetyAssessmentService service = fixture.assessmentService();
        service.analyze("r4", "rough day", "sad");
        service.analyze("r4", "rough day", "sad");
        service.analyze("r4", "rough day", "calm");

        EmotionalProgression p = reports.report("r4").emotionalProgression();

        assertEquals("concerning", p.overallTrend());
        assertEquals("sad", p.dominantEmotion());
    }

    @Test
    void unreadableLogFallsBackToTrackedHistory() {
        CrisisEventStore store = mock(CrisisEventStore.class);
        when(store.queryRecentEvents(anyString(), anyInt())).thenReturn(List.of());
        CrisisEngineFixture failing = new CrisisEngineFixture(store);
        failing.assessmentService().analyze("r5", "I keep thinking about suicide");
        when(store.queryRecentEvents(anyString(), anyInt())).thenThrow(new IllegalStateException("db down"));

        SessionSafetyReport r = failing.reportService().report("r5");

        assertEquals(1, r.totalCrisisEvents());
        assertEquals(6, r.highestCrisisLevel());
    }

    @Test
    void statisticsCountEventsInPeriod() {
        Instant now = Instant.now();
        fixture.store.appendEvent("a", event("a", now.minus(Duration.ofDays(40)), 9, CrisisType.SUICIDE_RISK, true));
        fixture.store.appendEvent("a", event("a", now.minus(Duration.ofDays(2)), 9, CrisisType.SUICIDE_RISK, true));
        fixture.store.appendEvent("b", event("b", now.minus(Duration.ofDays(1)), 6, CrisisType.VIOLENCE_RISK, false));
        fixture.store.appendEvent("b", event("b", now.minus(Duration.ofHours(1)), 7, CrisisType.VIOLENCE_RISK, false));

        SafetyStatistics s = reports.statistics(30);

        assertEquals(30, s.periodDays());
        assertEquals(3, s.totalCrisisEvents());
        assertEquals(1, s.escalatedEvents());
        assertEquals(2L, s.crisisTypes().get(CrisisType.VIOLENCE_RISK));
        assertEquals(1L, s.crisisTypes().get(CrisisType.SUICIDE_RISK));
        assertEquals(1.0 / 3.0, s.escalationRate(), 1e-9);
    }

    @Test
    void statisticsSurviveUnreadableLog() {
        CrisisEventStore store = mock(CrisisEventStore.class);
        when(store.findSince(any())).thenThrow(new IllegalStateException("db down"));

        SafetyStatistics s = new CrisisEngineFixture(store).reportService().statistics(7);

        assertEquals(0, s.totalCrisisEvents());
        assertEquals(0.0, s.escalationRate());
    }

    @Test
    void statisticsRejectNonPositivePeriod() {
        assertThrows(IllegalArgumentException.class, () -> reports.statistics(0));
    }

    @Test
    void healthReportsLoadedData() {
        fixture.assessmentService().analyze("h1", "hello");

        HealthStatus h = reports.health();

        assertEquals("healthy", h.status());
        assertEquals(7, h.crisisKeywordsLoaded());
        assertEquals(3, h.emergencyResourcesLoaded());
        assertEquals(1, h.activeSessionTracking());
        assertEquals(9, h.crisisThresholds().get("critical"));
    }
}
