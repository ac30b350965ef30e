package tech.noetzold.crisis_api.repository.impl;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import tech.noetzold.crisis_api.model.CrisisEvent;
import tech.noetzold.crisis_api.model.CrisisEventRecord;
import tech.noetzold.crisis_api.model.CrisisType;
import tech.noetzold.crisis_api.model.RiskCategory;
import tech.noetzold.crisis_api.repository.CrisisEventRecordRepository;
import tech.noetzold.crisis_api.repository.CrisisEventStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Repository
@ConditionalOnProperty(prefix = "crisis.store", name = "type", havingValue = "jpa", matchIfMissing = true)
public class JpaCrisisEventStore implements CrisisEventStore {

    private final CrisisEventRecordRepository recordRepo;

    public JpaCrisisEventStore(CrisisEventRecordRepository recordRepo) {
        this.recordRepo = recordRepo;
    }

    @Override
    @Transactional
    public void appendEvent(String sessionId, CrisisEvent event) {
        CrisisEventRecord rec = CrisisEventRecord.builder()
                .sessionId(sessionId)
                .crisisLevel(event.crisisLevel())
                .crisisType(event.crisisType().code())
                .contributingCategories(event.contributingCategories().stream()
                        .map(RiskCategory::code)
                        .collect(Collectors.joining(",")))
                .escalated(event.escalated())
                .followUpNeeded(true)
                .createdAt(event.timestamp())
                .build();
        recordRepo.save(rec);
    }

    @Override
    @Transactional(readOnly = true)
    public List<CrisisEvent> queryRecentEvents(String sessionId, int n) {
        if (sessionId == null || sessionId.isBlank() || n <= 0) {
            return List.of();
        }
        List<CrisisEvent> events = new ArrayList<>(recordRepo
                .findBySessionIdOrderByCreatedAtDescIdDesc(sessionId, PageRequest.of(0, n))
                .stream()
                .map(JpaCrisisEventStore::toEvent)
                .toList());
        Collections.reverse(events);
        return events;
    }

    @Override
    @Transactional(readOnly = true)
    public List<CrisisEvent> findSince(Instant since) {
        return recordRepo.findByCreatedAtGreaterThanEqualOrderByCreatedAtAsc(since)
                .stream()
                .map(JpaCrisisEventStore::toEvent)
                .toList();
    }

    private static CrisisEvent toEvent(CrisisEventRecord rec) {
        return new CrisisEvent(
                rec.getSessionId(),
                rec.getCreatedAt(),
                Math.max(0, Math.min(10, rec.getCrisisLevel())),
                CrisisType.fromCode(rec.getCrisisType()),
                parseCategories(rec.getContributingCategories()),
                rec.isEscalated()
        );
    }

    private static Set<RiskCategory> parseCategories(String csv) {
        Set<RiskCategory> out = EnumSet.noneOf(RiskCategory.class);
        if (csv == null || csv.isBlank()) return out;
        Arrays.stream(csv.split(","))
                .map(RiskCategory::fromCode)
                .forEach(c -> c.ifPresent(out::add));
        return out;
    }
}
