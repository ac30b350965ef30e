package tech.noetzold.crisis_api.service;

import org.junit.jupiter.api.Test;
import tech.noetzold.crisis_api.config.CrisisProperties;
import tech.noetzold.crisis_api.model.ContextSignals;
import tech.noetzold.crisis_api.model.CrisisEvent;
import tech.noetzold.crisis_api.model.CrisisType;
import tech.noetzold.crisis_api.repository.CrisisEventStore;
import tech.noetzold.crisis_api.repository.impl.InMemoryCrisisEventStore;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class SessionContextTrackerTest {

    private final CrisisProperties props = new CrisisProperties();

    private static CrisisEvent event(String sessionId, int level) {
        return new CrisisEvent(sessionId, Instant.now(), level, CrisisType.SUICIDE_RISK, Set.of(), false);
    }

    @Test
    void unknownSessionHasNoContextAndIsNotCreated() {
        SessionContextTracker tracker = new SessionContextTracker(new InMemoryCrisisEventStore(), props);

        assertEquals(ContextSignals.none(), tracker.getContext("nobody"));
        assertTrue(tracker.recentEvents("nobody").isEmpty());
        assertEquals(0, tracker.activeSessions());
    }

    @Test
    void historyKeepsTheTenMostRecentEvents() {
        SessionContextTracker tracker = new SessionContextTracker(new InMemoryCrisisEventStore(), props);

        for (int i = 0; i < 12; i++) {
            tracker.recordEvent("s1", event("s1", i % 2 == 0 ? 5 : 6));
        }

        List<CrisisEvent> events = tracker.recentEvents("s1");
        assertEquals(10, events.size());
        assertEquals(12, tracker.readSession("s1", SessionCrisisState::recordedEvents).orElseThrow());
    }

    @Test
    void evictionIsOldestFirst() {
        SessionContextTracker tracker = new SessionContextTracker(new InMemoryCrisisEventStore(), props);
        CrisisEvent first = new CrisisEvent("s1", Instant.parse("2026-01-01T00:00:00Z"), 9, CrisisType.VIOLENCE_RISK, Set.of(), false);

        tracker.recordEvent("s1", first);
        for (int i = 0; i < 10; i++) {
            tracker.recordEvent("s1", event("s1", 5));
        }

        assertFalse(tracker.recentEvents("s1").contains(first));
    }

    @Test
    void repeatedThemesSumTheLastThreeTurns() {
        SessionContextTracker tracker = new SessionContextTracker(new InMemoryCrisisEventStore(), props);

        tracker.withSession("s1", state -> {
            tracker.recordTurn(state, null, 5, "en");
            tracker.recordTurn(state, null, 1, "en");
            tracker.recordTurn(state, null, 1, "en");
            tracker.recordTurn(state, null, 0, "en");
            return null;
        });

        ContextSignals ctx = tracker.getContext("s1");
        assertEquals(2, ctx.repeatedCrisisThemes());
        assertFalse(ctx.escalationDetected());
    }

    @Test
    void threeNegativeEmotionsInLastFiveIsDeterioration() {
        SessionContextTracker tracker = new SessionContextTracker(new InMemoryCrisisEventStore(), props);

        tracker.withSession("s1", state -> {
            tracker.recordTurn(state, "sad", 0, "en");
            tracker.recordTurn(state, "calm", 0, "en");
            tracker.recordTurn(state, "anxious", 0, "en");
            tracker.recordTurn(state, "angry", 2, "en");
            tracker.recordTurn(state, "stressed", 1, "en");
            return null;
        });

        ContextSignals ctx = tracker.getContext("s1");
        assertTrue(ctx.emotionalDeterioration());
        assertTrue(ctx.escalationDetected());
        assertEquals(List.of("sad", "calm", "anxious", "angry", "stressed"), tracker.emotionTimeline("s1"));
    }

    @Test
    void historyIsHydratedFromTheStoreOnFirstAccess() {
        InMemoryCrisisEventStore store = new InMemoryCrisisEventStore();
        store.appendEvent("s1", event("s1", 7));
        store.appendEvent("s1", event("s1", 8));
        SessionContextTracker tracker = new SessionContextTracker(store, props);

        tracker.withSession("s1", state -> null);

        assertEquals(2, tracker.recentEvents("s1").size());
        assertEquals(2, tracker.getContext("s1").previousInterventions());
    }

    @Test
    void unreadableStoreStartsTheSessionEmpty() {
        CrisisEventStore store = mock(CrisisEventStore.class);
        when(store.queryRecentEvents(anyString(), anyInt())).thenThrow(new IllegalStateException("db down"));
        SessionContextTracker tracker = new SessionContextTracker(store, props);

        tracker.recordEvent("s1", event("s1", 6));

        assertEquals(1, tracker.recentEvents("s1").size());
        verify(store, times(1)).queryRecentEvents("s1", 10);
    }

    @Test
    void endSessionDropsStateAndReportsUnknownSessions() {
        SessionContextTracker tracker = new SessionContextTracker(new InMemoryCrisisEventStore(), props);
        tracker.recordEvent("s1", event("s1", 6));

        assertTrue(tracker.endSession("s1"));
        assertFalse(tracker.endSession("s1"));
        assertEquals(0, tracker.activeSessions());
        assertTrue(tracker.recentEvents("s1").isEmpty());
    }

    @Test
    void concurrentWritersOnOneSessionLoseNothing() throws Exception {
        props.getHistory().setMaxEvents(1000);
        SessionContextTracker tracker = new SessionContextTracker(new InMemoryCrisisEventStore(), props);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);

        for (int t = 0; t < 8; t++) {
            pool.submit(() -> {
                start.await();
                for (int i = 0; i < 50; i++) {
                    tracker.recordEvent("shared", event("shared", 5));
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(400, tracker.recentEvents("shared").size());
    }
}
