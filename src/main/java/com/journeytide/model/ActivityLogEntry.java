package com.journeytide.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only audit row, one per step an enrollment takes.
 *
 * Actions written by the engine: journey_started, node_trigger, node_action,
 * node_condition, node_delay, node_goal, node_exit, node_abtest,
 * timer_resumed, exit_path_branch, exit_path_continue, exit_path_wait,
 * exit_path_exit, engagement_timeout, enrollment_failed.
 */
@Entity
@Table(name = "journey_activity_log", indexes = {
    @Index(name = "idx_activity_enrollment", columnList = "enrollment_id")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ActivityLogEntry {

    @Id
    private UUID id;

    @Column(name = "enrollment_id", nullable = false, updatable = false)
    private UUID enrollmentId;

    @Column(name = "journey_id", nullable = false, updatable = false)
    private UUID journeyId;

    @Column(name = "node_id", updatable = false)
    private String nodeId;

    @Column(nullable = false, updatable = false)
    private String action;

    @Column(nullable = false, updatable = false)
    private Instant timestamp;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata", columnDefinition = "jsonb", updatable = false)
    private Map<String, Object> metadata;

    public static ActivityLogEntry of(JourneyEnrollment enrollment, String nodeId, String action,
                                      Map<String, Object> metadata, Instant timestamp) {
        ActivityLogEntry entry = new ActivityLogEntry();
        entry.id = UUID.randomUUID();
        entry.enrollmentId = enrollment.getId();
        entry.journeyId = enrollment.getJourneyId();
        entry.nodeId = nodeId;
        entry.action = action;
        entry.timestamp = timestamp;
        entry.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
        return entry;
    }
}
