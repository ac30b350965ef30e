package tech.noetzold.crisis_api.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tech.noetzold.crisis_api.config.CrisisProperties;
import tech.noetzold.crisis_api.model.ContextSignals;
import tech.noetzold.crisis_api.model.CrisisEvent;
import tech.noetzold.crisis_api.repository.CrisisEventStore;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Owns the per-session crisis history. A session is created on first analysis, hydrated
 * once from the {@link CrisisEventStore}, and dropped only by {@link #endSession(String)}.
 *
 * <p>All work on one session runs under that session's lock, so reads of the trailing
 * windows and the following append are atomic. Different sessions never share a lock.</p>
 */
@Slf4j
@Component
public class SessionContextTracker {

    private final Map<String, SessionCrisisState> sessions = new ConcurrentHashMap<>();
    private final CrisisEventStore store;
    private final CrisisProperties props;

    public SessionContextTracker(CrisisEventStore store, CrisisProperties props) {
        this.store = store;
        this.props = props;
    }

    /**
     * Runs {@code work} under the session lock, creating the session if needed.
     */
    public <T> T withSession(String sessionId, Function<SessionCrisisState, T> work) {
        while (true) {
            SessionCrisisState state = sessions.computeIfAbsent(sessionId, SessionCrisisState::new);
            state.lock().lock();
            try {
                if (state.closed()) {
                    continue; // ended while we waited, take the fresh one
                }
                if (!state.hydrated()) {
                    hydrate(state);
                }
                return work.apply(state);
            } finally {
                state.lock().unlock();
            }
        }
    }

    /**
     * Runs {@code work} under the session lock without creating the session. A session
     * registered by {@link #withSession} but not yet hydrated is hydrated here first.
     */
    public <T> Optional<T> readSession(String sessionId, Function<SessionCrisisState, T> work) {
        SessionCrisisState state = sessions.get(sessionId);
        if (state == null) {
            return Optional.empty();
        }
        state.lock().lock();
        try {
            if (state.closed()) return Optional.empty();
            if (!state.hydrated()) {
                hydrate(state);
            }
            return Optional.ofNullable(work.apply(state));
        } finally {
            state.lock().unlock();
        }
    }

    public ContextSignals getContext(String sessionId) {
        return readSession(sessionId, state -> getContext(state)).orElse(ContextSignals.none());
    }

    /**
     * Trend signals from the turns analysed before the current message. Read-only.
     */
    public ContextSignals getContext(SessionCrisisState state) {
        List<SessionCrisisState.Turn> turns = state.turns();
        if (turns.isEmpty() && state.recordedEvents() == 0) {
            return ContextSignals.none();
        }

        int contextWindow = props.getHistory().getContextWindow();
        int repeated = turns.subList(Math.max(0, turns.size() - contextWindow), turns.size())
                .stream()
                .mapToInt(SessionCrisisState.Turn::riskTermHits)
                .sum();

        int emotionWindow = props.getHistory().getEmotionWindow();
        long negative = turns.subList(Math.max(0, turns.size() - emotionWindow), turns.size())
                .stream()
                .map(SessionCrisisState.Turn::emotionalState)
                .filter(EmotionHintDetector::negative)
                .count();

        return new ContextSignals(repeated, repeated > 2, negative >= 3, state.recordedEvents());
    }

    public void recordTurn(SessionCrisisState state, String emotionalState, int riskTermHits, String language) {
        int cap = Math.max(props.getHistory().getContextWindow(), props.getHistory().getEmotionWindow());
        state.addTurn(new SessionCrisisState.Turn(emotionalState, riskTermHits), cap);
        state.language(language);
    }

    public void recordEvent(SessionCrisisState state, CrisisEvent event) {
        state.addEvent(event, props.getHistory().getMaxEvents());
    }

    public void recordEvent(String sessionId, CrisisEvent event) {
        withSession(sessionId, state -> {
            recordEvent(state, event);
            return null;
        });
    }

    public List<CrisisEvent> recentEvents(String sessionId) {
        return readSession(sessionId, SessionCrisisState::events).orElse(List.of());
    }

    public List<String> emotionTimeline(String sessionId) {
        return readSession(sessionId, SessionCrisisState::emotionTimeline).orElse(List.of());
    }

    public String language(String sessionId) {
        return readSession(sessionId, SessionCrisisState::language).orElse(LanguageDetector.ENGLISH);
    }

    public boolean endSession(String sessionId) {
        SessionCrisisState state = sessions.remove(sessionId);
        if (state == null) {
            return false;
        }
        state.lock().lock();
        try {
            state.close();
        } finally {
            state.lock().unlock();
        }
        log.info("Crisis tracking ended for session {}", sessionId);
        return true;
    }

    public int activeSessions() {
        return sessions.size();
    }

    private void hydrate(SessionCrisisState state) {
        int cap = props.getHistory().getMaxEvents();
        try {
            List<CrisisEvent> previous = store.queryRecentEvents(state.sessionId(), cap);
            if (previous != null) {
                previous.forEach(e -> state.addEvent(e, cap));
            }
        } catch (Exception e) {
            log.warn("Could not load crisis history for session {}, starting empty", state.sessionId(), e);
        }
        state.markHydrated();
    }
}
