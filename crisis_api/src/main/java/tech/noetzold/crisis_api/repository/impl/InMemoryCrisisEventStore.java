package tech.noetzold.crisis_api.repository.impl;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;
import tech.noetzold.crisis_api.model.CrisisEvent;
import tech.noetzold.crisis_api.repository.CrisisEventStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

@Repository
@ConditionalOnProperty(prefix = "crisis.store", name = "type", havingValue = "memory")
public class InMemoryCrisisEventStore implements CrisisEventStore {

    private final Map<String, List<CrisisEvent>> db = new ConcurrentHashMap<>();

    @Override
    public void appendEvent(String sessionId, CrisisEvent event) {
        db.computeIfAbsent(sessionId, k -> new CopyOnWriteArrayList<>()).add(event);
    }

    @Override
    public List<CrisisEvent> queryRecentEvents(String sessionId, int n) {
        if (sessionId == null || sessionId.isBlank() || n <= 0) {
            return List.of();
        }
        List<CrisisEvent> events = List.copyOf(db.getOrDefault(sessionId, List.of()));
        int from = Math.max(0, events.size() - n);
        return events.subList(from, events.size());
    }

    @Override
    public List<CrisisEvent> findSince(Instant since) {
        List<CrisisEvent> out = new ArrayList<>();
        db.values().forEach(events -> events.stream()
                .filter(e -> !e.timestamp().isBefore(since))
                .forEach(out::add));
        out.sort((a, b) -> a.timestamp().compareTo(b.timestamp()));
        return out;
    }
}
