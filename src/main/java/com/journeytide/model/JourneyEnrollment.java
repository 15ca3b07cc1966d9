package com.journeytide.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One customer's walk through one journey.
 *
 * currentNodeId is the node to execute next while ACTIVE, or the node the
 * enrollment is parked on while WAITING. Rows are never deleted; finished
 * enrollments stay behind to drive the re-entry policy.
 *
 * The id is assigned on creation so activity entries can reference it before
 * the first flush. The version column turns every save into a conditional
 * update; two writers racing on the same row lose with an
 * OptimisticLockingFailureException.
 */
@Entity
@Table(name = "journey_enrollments", indexes = {
    @Index(name = "idx_enrollments_journey_customer", columnList = "journey_id, customer_id"),
    @Index(name = "idx_enrollments_status", columnList = "status, waiting_timeout_at"),
    @Index(name = "idx_enrollments_external_message", columnList = "external_message_id")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class JourneyEnrollment {

    public static final String META_MESSAGE_ID = "whatsappMessageId";
    public static final String META_TIMEOUT_PATH = "timeoutPath";
    public static final String META_FAILURE = "failure";

    @Id
    private UUID id;

    @Version
    private Long version;

    @Column(name = "journey_id", nullable = false)
    private UUID journeyId;

    @Column(name = "customer_id", nullable = false)
    private String customerId;

    @Column(name = "customer_phone")
    private String customerPhone;

    @Column(name = "current_node_id")
    private String currentNodeId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private EnrollmentStatus status;

    @Column(name = "exit_reason")
    private String exitReason;

    @Embedded
    private WaitingForEvent waitingForEvent;

    @Column(name = "external_message_id")
    private String externalMessageId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata", columnDefinition = "jsonb")
    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    /** Variant assignments keyed by abtest node id. */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "experiments", columnDefinition = "jsonb")
    @Builder.Default
    private Map<String, ExperimentAssignment> experiments = new LinkedHashMap<>();

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt;

    @Column(name = "last_activity_at")
    private Instant lastActivityAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    public static JourneyEnrollment start(UUID journeyId, String customerId, String customerPhone,
                                          String triggerNodeId, Instant now) {
        return JourneyEnrollment.builder()
                .id(UUID.randomUUID())
                .journeyId(journeyId)
                .customerId(customerId)
                .customerPhone(customerPhone)
                .currentNodeId(triggerNodeId)
                .status(EnrollmentStatus.ACTIVE)
                .startedAt(now)
                .lastActivityAt(now)
                .updatedAt(now)
                .build();
    }

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    public boolean isWaitingFor(WaitType type) {
        return status == EnrollmentStatus.WAITING && waitingForEvent != null && waitingForEvent.getType() == type;
    }

    /** Points the enrollment at the next node and makes it runnable. */
    public void moveTo(String nodeId, Instant now) {
        this.currentNodeId = nodeId;
        this.status = EnrollmentStatus.ACTIVE;
        this.waitingForEvent = null;
        touch(now);
    }

    public void park(WaitingForEvent event, Instant now) {
        this.status = EnrollmentStatus.WAITING;
        this.waitingForEvent = event;
        touch(now);
    }

    public void complete(Instant now) {
        finish(EnrollmentStatus.COMPLETED, "goal_reached", now);
    }

    public void exit(String reason, Instant now) {
        finish(EnrollmentStatus.EXITED, reason, now);
    }

    public void fail(String reason, Instant now) {
        finish(EnrollmentStatus.FAILED, reason, now);
        metadataMap().put(META_FAILURE, reason);
    }

    public void recordMessage(String messageId) {
        this.externalMessageId = messageId;
        metadataMap().put(META_MESSAGE_ID, messageId);
    }

    public void setTimeoutPath(String timeoutPath) {
        if (timeoutPath == null || timeoutPath.isBlank()) {
            metadataMap().remove(META_TIMEOUT_PATH);
        } else {
            metadataMap().put(META_TIMEOUT_PATH, timeoutPath);
        }
    }

    public String getTimeoutPath() {
        Object value = metadataMap().get(META_TIMEOUT_PATH);
        return value != null ? value.toString() : null;
    }

    public void recordExperiment(String nodeId, ExperimentAssignment assignment) {
        if (experiments == null) {
            experiments = new LinkedHashMap<>();
        }
        experiments.put(nodeId, assignment);
    }

    /**
     * Instant from which the re-entry cooldown is measured.
     */
    public Instant finishedAt() {
        return completedAt != null ? completedAt : updatedAt;
    }

    /**
     * Detached copy used for dry runs, so simulated walks never touch managed state.
     */
    public JourneyEnrollment copy() {
        return JourneyEnrollment.builder()
                .id(id)
                .version(version)
                .journeyId(journeyId)
                .customerId(customerId)
                .customerPhone(customerPhone)
                .currentNodeId(currentNodeId)
                .status(status)
                .exitReason(exitReason)
                .waitingForEvent(waitingForEvent)
                .externalMessageId(externalMessageId)
                .metadata(new LinkedHashMap<>(metadataMap()))
                .experiments(experiments != null ? new LinkedHashMap<>(experiments) : new LinkedHashMap<>())
                .startedAt(startedAt)
                .lastActivityAt(lastActivityAt)
                .updatedAt(updatedAt)
                .completedAt(completedAt)
                .build();
    }

    private void finish(EnrollmentStatus terminal, String reason, Instant now) {
        this.status = terminal;
        this.exitReason = reason;
        this.waitingForEvent = null;
        this.completedAt = now;
        touch(now);
    }

    private void touch(Instant now) {
        this.lastActivityAt = now;
        this.updatedAt = now;
    }

    private Map<String, Object> metadataMap() {
        if (metadata == null) {
            metadata = new HashMap<>();
        }
        return metadata;
    }
}
