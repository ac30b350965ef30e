package tech.noetzold.crisis_api.service;

import tech.noetzold.crisis_api.model.CrisisEvent;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable crisis history of one session. Every read and write happens while holding
 * {@link #lock()}; {@link SessionContextTracker} is the only owner.
 */
public final class SessionCrisisState {

    static final int MAX_EMOTION_TIMELINE = 200;

    private final String sessionId;
    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<CrisisEvent> events = new ArrayDeque<>();
    private final Deque<Turn> turns = new ArrayDeque<>();
    private final Deque<String> emotionTimeline = new ArrayDeque<>();

    private int recordedEvents;
    private boolean hydrated;
    private boolean closed;
    private String language = LanguageDetector.ENGLISH;

    record Turn(String emotionalState, int riskTermHits) {}

    SessionCrisisState(String sessionId) {
        this.sessionId = sessionId;
    }

    public String sessionId() {
        return sessionId;
    }

    ReentrantLock lock() {
        return lock;
    }

    void addEvent(CrisisEvent event, int cap) {
        events.addLast(event);
        while (events.size() > cap) {
            events.removeFirst();
        }
        recordedEvents++;
    }

    void addTurn(Turn turn, int cap) {
        turns.addLast(turn);
        while (turns.size() > cap) {
            turns.removeFirst();
        }
        if (turn.emotionalState() != null) {
            emotionTimeline.addLast(turn.emotionalState());
            if (emotionTimeline.size() > MAX_EMOTION_TIMELINE) emotionTimeline.removeFirst();
        }
    }

    List<CrisisEvent> events() {
        return List.copyOf(events);
    }

    List<Turn> turns() {
        return List.copyOf(turns);
    }

    List<String> emotionTimeline() {
        return List.copyOf(emotionTimeline);
    }

    int recordedEvents() {
        return recordedEvents;
    }

    boolean hydrated() {
        return hydrated;
    }

    void markHydrated() {
        hydrated = true;
    }

    boolean closed() {
        return closed;
    }

    void close() {
        closed = true;
    }

    String language() {
        return language;
    }

    void language(String value) {
        if (value != null) language = value;
    }
}
