package com.journeytide.service;

import com.journeytide.config.JourneyEngineProperties;
import com.journeytide.dto.TemplateMessage;
import com.journeytide.model.ActivityLogEntry;
import com.journeytide.model.CustomerProfile;
import com.journeytide.model.EnrollmentStatus;
import com.journeytide.model.ExperimentAssignment;
import com.journeytide.model.Journey;
import com.journeytide.model.JourneyEnrollment;
import com.journeytide.model.WaitType;
import com.journeytide.model.WaitingForEvent;
import com.journeytide.model.graph.AbTestNode;
import com.journeytide.model.graph.ActionNode;
import com.journeytide.model.graph.ConditionNode;
import com.journeytide.model.graph.DelayNode;
import com.journeytide.model.graph.JourneyEdge;
import com.journeytide.model.graph.JourneyNode;
import com.journeytide.model.graph.Variant;
import com.journeytide.repository.CustomerProfileRepository;
import com.journeytide.repository.SegmentRepository;
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
 * Walks one enrollment through its journey graph.
 *
 * FLOW:
 *   1. Look up the node at currentNodeId (missing → FAILED)
 *   2. Execute it: follow an edge, park the enrollment, or finish it
 *   3. Repeat while the enrollment stays ACTIVE
 *   4. Persist the final state together with every activity entry of the walk
 *
 * LIVE walks run under a per-enrollment lease and only start when the stored
 * version still matches the copy in hand, so a message is sent by at most one
 * worker. A walk that cannot take the lease, or holds a stale copy, returns
 * lostRace without executing anything.
 *
 * A walk stops on:
 *   send_whatsapp  → WAITING for a message callback
 *   delay          → WAITING on a timer
 *   goal / exit    → COMPLETED / EXITED
 *   graph errors   → FAILED (dangling edge, no matching branch, bad experiment)
 *
 * The step limit guards against cycles in hand-edited graphs.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NodeGraphWalker {

    private final EnrollmentStore enrollmentStore;
    private final MessagingGateway messagingGateway;
    private final SegmentEvaluator segmentEvaluator;
    private final SegmentRepository segmentRepository;
    private final CustomerProfileRepository customerProfileRepository;
    private final ProfileUpdater profileUpdater;
    private final VariantAllocator variantAllocator;
    private final LeaseService leaseService;
    private final JourneyEngineProperties properties;
    private final Clock clock;

    public AdvanceResult advance(Journey journey, JourneyEnrollment enrollment, WalkMode mode) {
        return advance(journey, enrollment, mode, new ArrayList<>());
    }

    /**
     * Walks from currentNodeId, prepending entries already produced by the
     * caller so they are written in the same transaction as the walk.
     */
    public AdvanceResult advance(Journey journey, JourneyEnrollment enrollment, WalkMode mode,
                                 List<ActivityLogEntry> pending) {
        if (mode == WalkMode.DRY_RUN) {
            return walk(journey, enrollment, mode, pending);
        }

        String leaseKey = LeaseService.walkKey(enrollment.getId());
        Duration leaseTtl = Duration.ofSeconds(properties.getSweep().getEnrollmentLeaseSeconds());
        Optional<String> lease = leaseService.acquire(leaseKey, leaseTtl);
        if (lease.isEmpty()) {
            log.info("Walk skipped, enrollment held by another worker: enrollmentId={}", enrollment.getId());
            return new AdvanceResult(enrollment, mode, List.of(), pending, true);
        }
        try {
            Long storedVersion = enrollmentStore.findById(enrollment.getId())
                    .map(JourneyEnrollment::getVersion)
                    .orElse(null);
            if (storedVersion == null || !storedVersion.equals(enrollment.getVersion())) {
                log.info("Walk skipped, enrollment changed since it was loaded: enrollmentId={}, version={}, stored={}",
                        enrollment.getId(), enrollment.getVersion(), storedVersion);
                return new AdvanceResult(enrollment, mode, List.of(), pending, true);
            }
            return walk(journey, enrollment, mode, pending);
        } finally {
            leaseService.release(leaseKey, lease.get());
        }
    }

    private AdvanceResult walk(Journey journey, JourneyEnrollment enrollment, WalkMode mode,
                               List<ActivityLogEntry> pending) {
        List<ActivityLogEntry> entries = new ArrayList<>(pending);
        List<String> path = new ArrayList<>();
        Instant now = clock.instant();
        int maxSteps = properties.getSweep().getMaxStepsPerAdvance();

        int steps = 0;
        while (enrollment.getStatus() == EnrollmentStatus.ACTIVE) {
            if (steps++ >= maxSteps) {
                fail(enrollment, enrollment.getCurrentNodeId(), "max_steps_exceeded",
                        "Walk exceeded " + maxSteps + " steps, suspected cycle", entries, now);
                break;
            }
            Optional<JourneyNode> node = journey.findNode(enrollment.getCurrentNodeId());
            if (node.isEmpty()) {
                fail(enrollment, enrollment.getCurrentNodeId(), "node_not_found",
                        "Current node does not exist in the journey", entries, now);
                break;
            }
            path.add(node.get().getId());
            execute(journey, enrollment, node.get(), mode, entries, now);
        }

        return finish(enrollment, mode, path, entries);
    }

    /**
     * Continues a delay whose timer has elapsed.
     */
    public AdvanceResult resumeTimer(Journey journey, JourneyEnrollment enrollment) {
        Instant now = clock.instant();
        List<ActivityLogEntry> entries = new ArrayList<>();
        if (!enrollment.isWaitingFor(WaitType.TIMER)) {
            throw new IllegalStateException("Enrollment " + enrollment.getId() + " is not waiting on a timer");
        }

        String delayNodeId = enrollment.getCurrentNodeId();
        entries.add(ActivityLogEntry.of(enrollment, delayNodeId, "timer_resumed", Map.of(), now));
        log.info("Timer elapsed: enrollmentId={}, nodeId={}", enrollment.getId(), delayNodeId);
        followFirstEdge(journey, enrollment, delayNodeId, entries, now);

        return advance(journey, enrollment, WalkMode.LIVE, entries);
    }

    private void execute(Journey journey, JourneyEnrollment enrollment, JourneyNode node, WalkMode mode,
                         List<ActivityLogEntry> entries, Instant now) {
        switch (node.getType()) {
            case TRIGGER -> {
                entries.add(ActivityLogEntry.of(enrollment, node.getId(), "node_trigger", Map.of(), now));
                followFirstEdge(journey, enrollment, node.getId(), entries, now);
            }
            case ACTION -> executeAction(journey, enrollment, (ActionNode) node, mode, entries, now);
            case CONDITION -> executeCondition(journey, enrollment, (ConditionNode) node, entries, now);
            case DELAY -> executeDelay(journey, enrollment, (DelayNode) node, entries, now);
            case GOAL -> {
                entries.add(ActivityLogEntry.of(enrollment, node.getId(), "node_goal", Map.of(), now));
                enrollment.complete(now);
                log.info("Enrollment completed: enrollmentId={}, journeyId={}, goalNodeId={}",
                        enrollment.getId(), journey.getId(), node.getId());
            }
            case EXIT -> {
                entries.add(ActivityLogEntry.of(enrollment, node.getId(), "node_exit", Map.of(), now));
                enrollment.exit("exit_node", now);
                log.info("Enrollment exited: enrollmentId={}, journeyId={}, nodeId={}",
                        enrollment.getId(), journey.getId(), node.getId());
            }
            case ABTEST -> executeExperiment(journey, enrollment, (AbTestNode) node, entries, now);
        }
    }

    private void executeAction(Journey journey, JourneyEnrollment enrollment, ActionNode node, WalkMode mode,
                               List<ActivityLogEntry> entries, Instant now) {
        ActionNode.ActionConfig config = node.getConfig() != null ? node.getConfig() : new ActionNode.ActionConfig();
        boolean live = mode == WalkMode.LIVE;

        switch (node.kind()) {
            case SEND_WHATSAPP -> sendMessage(journey, enrollment, node, config, mode, entries, now);
            case ADD_TAG -> {
                if (live) {
                    profileUpdater.addTag(enrollment.getCustomerId(), config.getTagName());
                }
                entries.add(ActivityLogEntry.of(enrollment, node.getId(), "node_action",
                        details("subtype", "add_tag", "tag", config.getTagName()), now));
                followFirstEdge(journey, enrollment, node.getId(), entries, now);
            }
            case UPDATE_PROPERTY -> {
                if (live) {
                    profileUpdater.setProperty(enrollment.getCustomerId(), config.getPropertyKey(),
                            config.getPropertyValue());
                }
                entries.add(ActivityLogEntry.of(enrollment, node.getId(), "node_action",
                        details("subtype", "update_property", "property", config.getPropertyKey()), now));
                followFirstEdge(journey, enrollment, node.getId(), entries, now);
            }
        }
    }

    private void sendMessage(Journey journey, JourneyEnrollment enrollment, ActionNode node,
                             ActionNode.ActionConfig config, WalkMode mode,
                             List<ActivityLogEntry> entries, Instant now) {
        String phone = resolvePhone(enrollment);
        if (phone == null) {
            fail(enrollment, node.getId(), "no_phone", "Customer has no phone number", entries, now);
            return;
        }
        if (config.getTemplateName() == null || config.getTemplateName().isBlank()) {
            fail(enrollment, node.getId(), "missing_template", "Send action has no template", entries, now);
            return;
        }

        if (mode == WalkMode.DRY_RUN) {
            entries.add(ActivityLogEntry.of(enrollment, node.getId(), "node_action",
                    details("subtype", "send_whatsapp", "template", config.getTemplateName(), "dryRun", true), now));
            enrollment.park(WaitingForEvent.messageCallback(), now);
            return;
        }

        TemplateMessage message = TemplateMessage.builder()
                .templateName(config.getTemplateName())
                .language(config.getTemplateLanguage())
                .components(config.getComponents())
                .build();
        try {
            String messageId = messagingGateway.send(phone, message);
            enrollment.recordMessage(messageId);
            enrollment.park(WaitingForEvent.messageCallback(), now);
            entries.add(ActivityLogEntry.of(enrollment, node.getId(), "node_action",
                    details("subtype", "send_whatsapp", "template", config.getTemplateName(),
                            "messageId", messageId), now));
            log.info("Enrollment waiting for message callback: enrollmentId={}, journeyId={}, nodeId={}, messageId={}",
                    enrollment.getId(), journey.getId(), node.getId(), messageId);
        } catch (MessagingException e) {
            fail(enrollment, node.getId(), "send_failed", e.getMessage(), entries, now);
        }
    }

    private void executeCondition(Journey journey, JourneyEnrollment enrollment, ConditionNode node,
                                  List<ActivityLogEntry> entries, Instant now) {
        CustomerProfile customer = customerProfileRepository.findById(enrollment.getCustomerId())
                .orElseGet(() -> CustomerProfile.builder().id(enrollment.getCustomerId()).build());

        boolean outcome = segmentEvaluator.matches(customer, node.getConditionGroups());
        if (outcome && node.getSegmentId() != null && !node.getSegmentId().isBlank()) {
            outcome = segmentRepository.findById(node.getSegmentId())
                    .map(segment -> segmentEvaluator.matches(customer, segment.getConditionGroups()))
                    .orElse(false);
        }

        String label = node.labelFor(outcome);
        List<JourneyEdge> edges = journey.outgoingEdges(node.getId());
        Optional<JourneyEdge> edge = edges.stream().filter(e -> e.hasLabel(label)).findFirst()
                .or(() -> edges.stream().filter(JourneyEdge::isDefaultBranch).findFirst());

        entries.add(ActivityLogEntry.of(enrollment, node.getId(), "node_condition",
                details("result", outcome, "branch", label), now));

        if (edge.isEmpty()) {
            fail(enrollment, node.getId(), "no_matching_branch", "No edge labelled " + label, entries, now);
            return;
        }
        goTo(journey, enrollment, edge.get(), entries, now);
    }

    private void executeDelay(Journey journey, JourneyEnrollment enrollment, DelayNode node,
                              List<ActivityLogEntry> entries, Instant now) {
        Instant resumeAt = node.resumeAt(now);
        if (resumeAt == null || !resumeAt.isAfter(now)) {
            entries.add(ActivityLogEntry.of(enrollment, node.getId(), "node_delay", details("skipped", true), now));
            followFirstEdge(journey, enrollment, node.getId(), entries, now);
            return;
        }
        enrollment.park(WaitingForEvent.timer(resumeAt), now);
        entries.add(ActivityLogEntry.of(enrollment, node.getId(), "node_delay",
                details("resumeAt", resumeAt.toString()), now));
        log.info("Enrollment waiting on timer: enrollmentId={}, nodeId={}, resumeAt={}",
                enrollment.getId(), node.getId(), resumeAt);
    }

    private void executeExperiment(Journey journey, JourneyEnrollment enrollment, AbTestNode node,
                                   List<ActivityLogEntry> entries, Instant now) {
        Variant variant;
        try {
            variant = variantAllocator.allocate(enrollment.getId(), node.getId(), node.getVariants());
        } catch (IllegalArgumentException e) {
            fail(enrollment, node.getId(), "invalid_experiment", e.getMessage(), entries, now);
            return;
        }

        List<JourneyEdge> edges = journey.outgoingEdges(node.getId());
        Optional<JourneyEdge> edge = edges.stream().filter(e -> e.hasLabel(variant.edgeLabel())).findFirst()
                .or(() -> edges.stream().filter(e -> e.hasLabel(variant.getId())).findFirst());

        ExperimentAssignment assignment = ExperimentAssignment.builder()
                .variantId(variant.getId())
                .label(variant.edgeLabel())
                .weight(variant.getWeight())
                .edgeId(edge.map(JourneyEdge::getId).orElse(null))
                .assignedAt(now)
                .build();
        enrollment.recordExperiment(node.getId(), assignment);
        entries.add(ActivityLogEntry.of(enrollment, node.getId(), "node_abtest", assignment.toDetails(), now));

        if (edge.isEmpty()) {
            fail(enrollment, node.getId(), "no_variant_edge",
                    "No edge for variant " + variant.edgeLabel(), entries, now);
            return;
        }
        goTo(journey, enrollment, edge.get(), entries, now);
    }

    /**
     * Follows the node's first outgoing edge; a node without one ends the walk.
     */
    void followFirstEdge(Journey journey, JourneyEnrollment enrollment, String nodeId,
                         List<ActivityLogEntry> entries, Instant now) {
        Optional<JourneyEdge> edge = journey.firstOutgoingEdge(nodeId);
        if (edge.isEmpty()) {
            enrollment.exit("end_of_path", now);
            entries.add(ActivityLogEntry.of(enrollment, nodeId, "end_of_path", Map.of(), now));
            log.info("Enrollment reached end of path: enrollmentId={}, nodeId={}", enrollment.getId(), nodeId);
            return;
        }
        goTo(journey, enrollment, edge.get(), entries, now);
    }

    private void goTo(Journey journey, JourneyEnrollment enrollment, JourneyEdge edge,
                      List<ActivityLogEntry> entries, Instant now) {
        if (journey.findNode(edge.getTarget()).isEmpty()) {
            fail(enrollment, edge.getSource(), "dangling_edge",
                    "Edge " + edge.getId() + " points at missing node " + edge.getTarget(), entries, now);
            return;
        }
        enrollment.moveTo(edge.getTarget(), now);
    }

    private void fail(JourneyEnrollment enrollment, String nodeId, String reason, String detail,
                      List<ActivityLogEntry> entries, Instant now) {
        enrollment.fail(reason, now);
        entries.add(ActivityLogEntry.of(enrollment, nodeId, "enrollment_failed",
                details("reason", reason, "detail", detail), now));
        log.error("Enrollment failed: enrollmentId={}, journeyId={}, customerId={}, nodeId={}, reason={}, detail={}",
                enrollment.getId(), enrollment.getJourneyId(), enrollment.getCustomerId(), nodeId, reason, detail);
    }

    private AdvanceResult finish(JourneyEnrollment enrollment, WalkMode mode, List<String> path,
                                 List<ActivityLogEntry> entries) {
        if (mode == WalkMode.DRY_RUN) {
            return new AdvanceResult(enrollment, mode, path, entries, false);
        }
        try {
            JourneyEnrollment saved = enrollmentStore.save(enrollment, entries);
            return new AdvanceResult(saved, mode, path, entries, false);
        } catch (OptimisticLockingFailureException e) {
            log.info("Lost race persisting enrollment, skipping: enrollmentId={}", enrollment.getId());
            return new AdvanceResult(enrollment, mode, path, entries, true);
        }
    }

    private String resolvePhone(JourneyEnrollment enrollment) {
        if (enrollment.getCustomerPhone() != null && !enrollment.getCustomerPhone().isBlank()) {
            return enrollment.getCustomerPhone();
        }
        return customerProfileRepository.findById(enrollment.getCustomerId())
                .map(CustomerProfile::getPhone)
                .filter(phone -> !phone.isBlank())
                .orElse(null);
    }

    private static Map<String, Object> details(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            map.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return map;
    }
}
