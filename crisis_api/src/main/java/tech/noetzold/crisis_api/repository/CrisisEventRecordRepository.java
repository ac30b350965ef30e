package tech.noetzold.crisis_api.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import tech.noetzold.crisis_api.model.CrisisEventRecord;

import java.time.Instant;
import java.util.List;

public interface CrisisEventRecordRepository extends JpaRepository<CrisisEventRecord, Long> {

    List<CrisisEventRecord> findBySessionIdOrderByCreatedAtDescIdDesc(String sessionId, Pageable pageable);

    List<CrisisEventRecord> findByCreatedAtGreaterThanEqualOrderByCreatedAtAsc(Instant since);
}
