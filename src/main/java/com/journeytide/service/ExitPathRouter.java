package com.journeytide.service;

import com.journeytide.dto.AnalyticsEvent;
import com.journeytide.dto.CallbackBatchResult;
import com.journeytide.dto.EngineIssue;
import com.journeytide.dto.InteractiveReply;
import com.journeytide.dto.StatusCallback;
import com.journeytide.model.ActivityLogEntry;
import com.journeytide.model.EnrollmentStatus;
import com.journeytide.model.Journey;
import com.journeytide.model.JourneyEnrollment;
import com.journeytide.model.WaitType;
import com.journeytide.model.WaitingForEvent;
import com.journeytide.model.graph.ActionNode;
import com.journeytide.model.graph.ButtonExitPath;
import com.journeytide.model.graph.CallbackKind;
import com.journeytide.model.graph.ExitAction;
import com.journeytide.model.graph.ExitActionType;
import com.journeytide.model.graph.ExitPath;
import com.journeytide.model.graph.ExitPaths;
import com.journeytide.model.graph.JourneyNode;
import com.journeytide.model.graph.NodeType;
import com.journeytide.model.graph.ProfileUpdate;
import com.journeytide.repository.JourneyRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Applies delivery and engagement callbacks to the enrollment parked on the
 * send node that produced the message.
 *
 * FLOW (per callback):
 *   1. Find the enrollment by message id; it must be WAITING and still be
 *      parked on the sending action node
 *   2. Pick the enabled exit path for the callback kind (buttons by id)
 *   3. Route in memory: branch | continue | wait (read only) | exit
 *   4. Dedup on (messageId, kind[, buttonId])
 *   5. Commit enrollment, activity entry and button profile updates together
 *   6. Track the event once the commit went through
 *
 * Callbacks skipped before step 4 leave no dedup key, so a status that
 * arrives before its send was persisted is applied when redelivered. Nothing
 * outside the enrollment row changes unless the commit succeeds.
 *
 * Branch and continue only make the enrollment ACTIVE again; the next sweep
 * walks it. One bad record never stops the rest of the batch.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExitPathRouter {

    static final int DEFAULT_WAIT_MINUTES = 60;

    private final EnrollmentStore enrollmentStore;
    private final JourneyRepository journeyRepository;
    private final DeduplicationService deduplicationService;
    private final AnalyticsPublisher analyticsPublisher;
    private final TransitionWriter transitionWriter;
    private final NodeGraphWalker walker;
    private final Clock clock;

    private enum Routed { PROCESSED, SKIPPED }

    public CallbackBatchResult handleStatusBatch(List<StatusCallback> callbacks) {
        CallbackBatchResult result = new CallbackBatchResult();
        for (StatusCallback callback : callbacks) {
            CallbackKind kind = callback != null ? CallbackKind.fromStatus(callback.getStatus()) : null;
            try {
                if (callback == null || callback.getMessageId() == null || callback.getMessageId().isBlank()) {
                    throw new IllegalArgumentException("Status callback without a message id");
                }
                if (kind == null) {
                    log.debug("Ignoring status {} for messageId={}", callback.getStatus(), callback.getMessageId());
                    result.setSkipped(result.getSkipped() + 1);
                    continue;
                }
                count(result, route(callback.getMessageId(), kind, null, statusProperties(callback), result));
            } catch (Exception e) {
                recordFailure(result, callback != null ? callback.getMessageId() : null, kind, null, e);
            }
        }
        log.info("Status batch handled: processed={}, skipped={}, failed={}",
                result.getProcessed(), result.getSkipped(), result.getFailed());
        return result;
    }

    public CallbackBatchResult handleReplyBatch(List<InteractiveReply> replies) {
        CallbackBatchResult result = new CallbackBatchResult();
        for (InteractiveReply reply : replies) {
            try {
                if (reply == null || reply.getMessageId() == null || reply.getMessageId().isBlank()
                        || reply.getButtonId() == null || reply.getButtonId().isBlank()) {
                    throw new IllegalArgumentException("Reply without a message id or button id");
                }
                count(result, route(reply.getMessageId(), CallbackKind.BUTTON_CLICKED, reply.getButtonId(),
                        replyProperties(reply), result));
            } catch (Exception e) {
                recordFailure(result, reply != null ? reply.getMessageId() : null, CallbackKind.BUTTON_CLICKED,
                        reply != null ? reply.getButtonId() : null, e);
            }
        }
        log.info("Reply batch handled: processed={}, skipped={}, failed={}",
                result.getProcessed(), result.getSkipped(), result.getFailed());
        return result;
    }

    /**
     * Called by the sweep for an ENGAGEMENT_WAIT enrollment whose timeout
     * elapsed. Without a timeoutPath the enrollment stays WAITING and
     * Optional.empty() is returned.
     */
    public Optional<AdvanceResult> handleEngagementTimeout(Journey journey, JourneyEnrollment enrollment) {
        if (!enrollment.isWaitingFor(WaitType.ENGAGEMENT_WAIT)) {
            return Optional.empty();
        }
        String timeoutPath = enrollment.getTimeoutPath();
        if (timeoutPath == null) {
            log.debug("Engagement wait elapsed without timeout path, still waiting: enrollmentId={}",
                    enrollment.getId());
            return Optional.empty();
        }

        Instant now = clock.instant();
        List<ActivityLogEntry> entries = new ArrayList<>();
        Optional<JourneyNode> target = journey.findBranchTarget(timeoutPath);
        if (target.isEmpty()) {
            enrollment.fail("timeout_path_not_found", now);
            entries.add(ActivityLogEntry.of(enrollment, enrollment.getCurrentNodeId(), "enrollment_failed",
                    Map.of("reason", "timeout_path_not_found", "timeoutPath", timeoutPath), now));
            log.error("Engagement timeout path not found: enrollmentId={}, journeyId={}, timeoutPath={}",
                    enrollment.getId(), journey.getId(), timeoutPath);
            return Optional.of(walker.advance(journey, enrollment, WalkMode.LIVE, entries));
        }

        entries.add(ActivityLogEntry.of(enrollment, enrollment.getCurrentNodeId(), "engagement_timeout",
                Map.of("timeoutPath", timeoutPath, "targetNodeId", target.get().getId()), now));
        enrollment.setTimeoutPath(null);
        enrollment.moveTo(target.get().getId(), now);
        log.info("Engagement wait timed out: enrollmentId={}, routedTo={}", enrollment.getId(), target.get().getId());
        return Optional.of(walker.advance(journey, enrollment, WalkMode.LIVE, entries));
    }

    private Routed route(String messageId, CallbackKind kind, String buttonId,
                         Map<String, Object> trackingProperties, CallbackBatchResult result) {
        Optional<JourneyEnrollment> found = enrollmentStore.findByExternalMessageId(messageId);
        if (found.isEmpty()) {
            log.info("No enrollment for messageId={}, kind={}", messageId, kind);
            return Routed.SKIPPED;
        }
        JourneyEnrollment enrollment = found.get();
        if (enrollment.getStatus() != EnrollmentStatus.WAITING) {
            log.debug("Enrollment no longer waiting: enrollmentId={}, status={}", enrollment.getId(), enrollment.getStatus());
            return Routed.SKIPPED;
        }

        Optional<Journey> journey = journeyRepository.findById(enrollment.getJourneyId());
        if (journey.isEmpty()) {
            log.warn("Journey gone for enrollmentId={}, journeyId={}", enrollment.getId(), enrollment.getJourneyId());
            return Routed.SKIPPED;
        }

        Optional<ExitPaths> exitPaths = journey.get().findNode(enrollment.getCurrentNodeId())
                .filter(node -> node.getType() == NodeType.ACTION)
                .map(ActionNode.class::cast)
                .filter(ActionNode::sendsMessage)
                .map(ActionNode::exitPaths);
        if (exitPaths.isEmpty()) {
            log.debug("Enrollment moved past the sending node: enrollmentId={}, currentNodeId={}",
                    enrollment.getId(), enrollment.getCurrentNodeId());
            return Routed.SKIPPED;
        }

        Optional<ExitPath> path = exitPaths.get().resolve(kind, buttonId);
        if (path.isEmpty()) {
            log.debug("No enabled exit path: enrollmentId={}, kind={}, buttonId={}", enrollment.getId(), kind, buttonId);
            return Routed.SKIPPED;
        }

        ExitAction action = path.get().getAction();
        if (action.getType() == ExitActionType.WAIT && kind != CallbackKind.READ) {
            log.debug("Wait exit path only applies to read receipts: enrollmentId={}, kind={}", enrollment.getId(), kind);
            return Routed.SKIPPED;
        }

        List<ActivityLogEntry> entries = new ArrayList<>();
        if (!applyAction(journey.get(), enrollment, kind, action, entries, result)) {
            return Routed.SKIPPED;
        }

        if (deduplicationService.isDuplicate(messageId, kind, buttonId)) {
            return Routed.SKIPPED;
        }

        List<ProfileUpdate> profileUpdates = kind == CallbackKind.BUTTON_CLICKED
                ? path.get().getProfileUpdates()
                : List.of();
        try {
            transitionWriter.commit(enrollment, entries, profileUpdates);
        } catch (OptimisticLockingFailureException e) {
            log.info("Lost race applying callback, skipping: enrollmentId={}, messageId={}, kind={}",
                    enrollment.getId(), messageId, kind);
            return Routed.SKIPPED;
        }

        if (path.get().tracks()) {
            if (path.get() instanceof ButtonExitPath) {
                ButtonExitPath.ButtonConfig button = ((ButtonExitPath) path.get()).getButtonConfig();
                trackingProperties.put("customPayload", button != null ? button.getCustomPayload() : null);
            }
            analyticsPublisher.publish(AnalyticsEvent.builder()
                    .eventName(path.get().getTracking().getEventName())
                    .enrollmentId(enrollment.getId())
                    .journeyId(enrollment.getJourneyId())
                    .customerId(enrollment.getCustomerId())
                    .properties(trackingProperties)
                    .occurredAt(clock.instant())
                    .build());
        }
        return Routed.PROCESSED;
    }

    /**
     * @return false when the action could not be applied and the callback is skipped
     */
    private boolean applyAction(Journey journey, JourneyEnrollment enrollment, CallbackKind kind, ExitAction action,
                                List<ActivityLogEntry> entries, CallbackBatchResult result) {
        Instant now = clock.instant();
        String nodeId = enrollment.getCurrentNodeId();
        String kindName = kind.name().toLowerCase();

        switch (action.getType()) {
            case BRANCH -> {
                Optional<JourneyNode> target = journey.findBranchTarget(action.getBranchId());
                if (target.isEmpty()) {
                    log.warn("Branch target not found: enrollmentId={}, journeyId={}, branchId={}",
                            enrollment.getId(), journey.getId(), action.getBranchId());
                    result.getIssues().add(EngineIssue.warn("Exit path branch target not found", Map.of(
                            "enrollmentId", String.valueOf(enrollment.getId()),
                            "journeyId", String.valueOf(journey.getId()),
                            "branchId", String.valueOf(action.getBranchId()))));
                    return false;
                }
                entries.add(ActivityLogEntry.of(enrollment, target.get().getId(), "exit_path_branch",
                        Map.of("callback", kindName, "fromNodeId", nodeId, "branchId", action.getBranchId()), now));
                enrollment.moveTo(target.get().getId(), now);
                log.info("Callback routed: enrollmentId={}, kind={}, branch {} → {}",
                        enrollment.getId(), kindName, nodeId, target.get().getId());
            }
            case CONTINUE -> {
                entries.add(ActivityLogEntry.of(enrollment, nodeId, "exit_path_continue",
                        Map.of("callback", kindName), now));
                walker.followFirstEdge(journey, enrollment, nodeId, entries, now);
                log.info("Callback routed: enrollmentId={}, kind={}, continue from {}",
                        enrollment.getId(), kindName, nodeId);
            }
            case WAIT -> {
                int minutes = action.getWaitDuration() != null && action.getWaitDuration() > 0
                        ? action.getWaitDuration()
                        : DEFAULT_WAIT_MINUTES;
                Instant timeoutAt = now.plus(Duration.ofMinutes(minutes));
                enrollment.park(WaitingForEvent.engagementWait(timeoutAt), now);
                enrollment.setTimeoutPath(action.getTimeoutPath());
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("callback", kindName);
                details.put("timeoutAt", timeoutAt.toString());
                details.put("timeoutPath", action.getTimeoutPath());
                entries.add(ActivityLogEntry.of(enrollment, nodeId, "exit_path_wait", details, now));
                log.info("Callback routed: enrollmentId={}, kind={}, waiting until {}",
                        enrollment.getId(), kindName, timeoutAt);
            }
            case EXIT -> {
                entries.add(ActivityLogEntry.of(enrollment, nodeId, "exit_path_exit",
                        Map.of("callback", kindName), now));
                enrollment.exit("exit_path_" + kindName, now);
                log.info("Callback routed: enrollmentId={}, kind={}, exited at {}",
                        enrollment.getId(), kindName, nodeId);
            }
        }
        return true;
    }

    private Map<String, Object> statusProperties(StatusCallback callback) {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("messageId", callback.getMessageId());
        properties.put("status", callback.getStatus());
        properties.put("timestamp", callback.getTimestamp());
        if (callback.getErrors() != null && !callback.getErrors().isEmpty()) {
            properties.put("errors", callback.getErrors());
        }
        return properties;
    }

    private Map<String, Object> replyProperties(InteractiveReply reply) {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("messageId", reply.getMessageId());
        properties.put("buttonId", reply.getButtonId());
        properties.put("buttonText", reply.getButtonText());
        properties.put("phoneNumber", reply.getFrom());
        return properties;
    }

    private void count(CallbackBatchResult result, Routed routed) {
        if (routed == Routed.PROCESSED) {
            result.setProcessed(result.getProcessed() + 1);
        } else {
            result.setSkipped(result.getSkipped() + 1);
        }
    }

    private void recordFailure(CallbackBatchResult result, String messageId, CallbackKind kind, String buttonId,
                               Exception e) {
        log.error("Failed to apply callback: messageId={}, kind={}, error={}", messageId, kind, e.getMessage(), e);
        result.setFailed(result.getFailed() + 1);
        result.getIssues().add(EngineIssue.error("Callback failed: " + e.getMessage(),
                Map.of("messageId", String.valueOf(messageId), "kind", String.valueOf(kind))));
        if (kind != null) {
            deduplicationService.clear(messageId, kind, buttonId);
        }
    }
}
