package tech.noetzold.crisis_api.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "crisis_events", indexes = {
        @Index(name = "idx_crisis_events_session", columnList = "session_id"),
        @Index(name = "idx_crisis_events_created", columnList = "created_at")
})
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CrisisEventRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", length = 120, nullable = false)
    private String sessionId;

    @Column(name = "crisis_level", nullable = false)
    private int crisisLevel;

    @Column(name = "crisis_type", length = 40, nullable = false)
    private String crisisType;

    @Column(name = "contributing_categories", length = 255)
    private String contributingCategories; // comma separated category codes

    @Column(name = "escalated", nullable = false)
    private boolean escalated;

    @Column(name = "follow_up_needed", nullable = false)
    private boolean followUpNeeded;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    public void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
