package tech.noetzold.crisis_api.repository;

import tech.noetzold.crisis_api.model.CrisisEvent;

import java.time.Instant;
import java.util.List;

/**
 * Durable log of crisis events. Implementations own durability and retries; callers treat
 * every failure as non-fatal.
 */
public interface CrisisEventStore {

    void appendEvent(String sessionId, CrisisEvent event);

    /** Most recent {@code n} events of the session, oldest first. */
    List<CrisisEvent> queryRecentEvents(String sessionId, int n);

    List<CrisisEvent> findSince(Instant since);
}
