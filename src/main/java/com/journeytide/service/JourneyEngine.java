package com.journeytide.service;

import com.journeytide.config.JourneyEngineProperties;
import com.journeytide.dto.EngineIssue;
import com.journeytide.dto.SimulationResult;
import com.journeytide.dto.SweepSummary;
import com.journeytide.model.CustomerProfile;
import com.journeytide.model.Journey;
import com.journeytide.model.JourneyEnrollment;
import com.journeytide.model.JourneyStatus;
import com.journeytide.model.graph.TriggerNode;
import com.journeytide.model.graph.TriggerType;
import com.journeytide.repository.CustomerProfileRepository;
import com.journeytide.repository.JourneyRepository;
import jakarta.annotation.PreDestroy;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The journey engine driver.
 *
 * FLOW (one sweep):
 *   1. For every ACTIVE journey: resolve trigger candidates and try to enroll each
 *   2. Advance every ACTIVE enrollment until it waits or finishes
 *   3. Resume WAITING enrollments whose timer or engagement wait elapsed
 *   4. Return a summary with counters and every issue met on the way
 *
 * Only one sweep runs at a time: a local flag guards this instance and a
 * Redis lease guards the cluster. A second caller gets a declined summary.
 * Each journey and each enrollment is isolated, so one failure is reported
 * and the sweep carries on.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JourneyEngine {

    private final JourneyRepository journeyRepository;
    private final CustomerProfileRepository customerProfileRepository;
    private final TriggerResolver triggerResolver;
    private final EnrollmentManager enrollmentManager;
    private final NodeGraphWalker walker;
    private final ExitPathRouter exitPathRouter;
    private final EnrollmentStore enrollmentStore;
    private final LeaseService leaseService;
    private final MessagingGateway messagingGateway;
    private final JourneyEngineProperties properties;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    public SweepSummary runSweep() {
        SweepSummary summary = SweepSummary.builder().startedAt(clock.instant()).build();

        if (!running.compareAndSet(false, true)) {
            log.info("Sweep declined, one is already running on this instance");
            return decline(summary);
        }
        Optional<String> lock = Optional.empty();
        try {
            lock = leaseService.acquire(LeaseService.SWEEP_LOCK_KEY,
                    Duration.ofSeconds(properties.getSweep().getLockTtlSeconds()));
            if (lock.isEmpty()) {
                log.info("Sweep declined, another instance holds the sweep lock");
                return decline(summary);
            }
            cancelRequested.set(false);
            log.info("Sweep started");

            Set<UUID> aborted = new HashSet<>();
            Map<UUID, Optional<Journey>> journeys = new HashMap<>();

            enrollCandidates(summary, aborted);
            if (!checkCancelled(summary)) {
                advanceActive(summary, aborted, journeys);
            }
            if (!checkCancelled(summary)) {
                resumeWaiting(summary, aborted, journeys);
            }
        } finally {
            lock.ifPresent(token -> leaseService.release(LeaseService.SWEEP_LOCK_KEY, token));
            running.set(false);
        }

        summary.setFinishedAt(clock.instant());
        log.info("Sweep finished: journeys={}, created={}, advanced={}, resumed={}, skipped={}, errors={}, cancelled={}",
                summary.getJourneysProcessed(), summary.getEnrollmentsCreated(), summary.getEnrollmentsAdvanced(),
                summary.getEnrollmentsResumed(), summary.getSkipped(), summary.getErrors().size(),
                summary.isCancelled());
        return summary;
    }

    /**
     * Asks a running sweep to stop at the next enrollment boundary.
     */
    public void cancel() {
        cancelRequested.set(true);
    }

    public boolean isRunning() {
        return running.get();
    }

    @PreDestroy
    void onShutdown() {
        shuttingDown.set(true);
    }

    public SimulationResult simulate(UUID journeyId, List<String> customerIds, List<String> phoneNumbers) {
        Journey journey = journeyRepository.findById(journeyId)
                .orElseThrow(() -> new EntityNotFoundException("Journey not found: " + journeyId));

        List<EnrollmentCandidate> candidates = new ArrayList<>();
        if (customerIds != null) {
            for (String customerId : customerIds) {
                String phone = customerProfileRepository.findById(customerId)
                        .map(CustomerProfile::getPhone)
                        .orElse(null);
                candidates.add(new EnrollmentCandidate(customerId, phone));
            }
        }
        if (phoneNumbers != null) {
            for (String phone : phoneNumbers) {
                String customerId = customerProfileRepository.findFirstByPhone(phone)
                        .map(CustomerProfile::getId)
                        .orElse("test_" + phone);
                candidates.add(new EnrollmentCandidate(customerId, phone));
            }
        }

        List<SimulationResult.SimulatedCustomer> simulated = new ArrayList<>();
        for (EnrollmentCandidate candidate : candidates) {
            EnrollmentOutcome outcome = enrollmentManager.tryEnroll(journey, candidate, WalkMode.DRY_RUN);
            SimulationResult.SimulatedCustomer.SimulatedCustomerBuilder row = SimulationResult.SimulatedCustomer.builder()
                    .customerId(candidate.getCustomerId())
                    .phone(candidate.getPhone())
                    .eligible(outcome.isEnrolled())
                    .skipReason(outcome.getSkipReason())
                    .path(List.of());
            if (outcome.isEnrolled()) {
                JourneyEnrollment walked = outcome.getAdvance().getEnrollment();
                row.path(outcome.getAdvance().getPath())
                        .finalStatus(walked.getStatus())
                        .finalNodeId(walked.getCurrentNodeId())
                        .waitingFor(walked.getWaitingForEvent() != null ? walked.getWaitingForEvent().getType() : null)
                        .exitReason(walked.getExitReason());
            }
            simulated.add(row.build());
        }

        log.info("Journey simulated: journeyId={}, customers={}", journeyId, simulated.size());
        return SimulationResult.builder()
                .journeyId(journey.getId())
                .journeyName(journey.getName())
                .customers(simulated)
                .message("Journey test simulated. No live enrollments were created.")
                .build();
    }

    private void enrollCandidates(SweepSummary summary, Set<UUID> aborted) {
        for (Journey journey : journeyRepository.findByStatus(JourneyStatus.ACTIVE)) {
            if (checkCancelled(summary)) {
                return;
            }
            if (!takesPart(journey)) {
                log.debug("Skipping test-mode journey: journeyId={}", journey.getId());
                continue;
            }
            try {
                if (!enrollJourney(journey, summary)) {
                    aborted.add(journey.getId());
                }
                summary.incrementJourneysProcessed();
            } catch (Exception e) {
                aborted.add(journey.getId());
                log.error("Journey failed during enrollment: journeyId={}, error={}", journey.getId(), e.getMessage(), e);
                summary.addIssue(EngineIssue.error("Journey enrollment failed: " + e.getMessage(),
                        Map.of("journeyId", String.valueOf(journey.getId()))));
            }
        }
    }

    /**
     * @return false when a fatal precondition aborted the journey
     */
    private boolean enrollJourney(Journey journey, SweepSummary summary) {
        Optional<TriggerNode> trigger = journey.findTriggerNode();
        if (trigger.isEmpty()) {
            log.error("Active journey has no trigger node: journeyId={}", journey.getId());
            summary.addIssue(EngineIssue.error("Journey has no trigger node",
                    Map.of("journeyId", String.valueOf(journey.getId()))));
            return false;
        }
        if (journey.hasSendActions() && !messagingGateway.isConfigured()) {
            log.error("Messaging gateway not configured, journey aborted: journeyId={}", journey.getId());
            summary.addIssue(EngineIssue.error("Messaging gateway is not configured",
                    Map.of("journeyId", String.valueOf(journey.getId()))));
            return false;
        }
        if (trigger.get().resolveSubtype() == TriggerType.MANUAL_ENTRY) {
            log.debug("Manual-entry journey, nothing to poll: journeyId={}", journey.getId());
            return true;
        }

        TriggerResolution resolution = triggerResolver.resolve(journey, trigger.get());
        summary.addIssues(resolution.getIssues());

        for (EnrollmentCandidate candidate : resolution.getCandidates()) {
            if (checkCancelled(summary)) {
                return true;
            }
            try {
                EnrollmentOutcome outcome = enrollmentManager.tryEnroll(journey, candidate, WalkMode.LIVE);
                if (outcome.isEnrolled()) {
                    summary.incrementCreated();
                } else {
                    summary.incrementSkipped();
                }
            } catch (Exception e) {
                log.error("Failed to enroll customer: journeyId={}, customerId={}, error={}",
                        journey.getId(), candidate.getCustomerId(), e.getMessage(), e);
                summary.addIssue(EngineIssue.error("Failed to enroll customer: " + e.getMessage(), Map.of(
                        "journeyId", String.valueOf(journey.getId()),
                        "customerId", String.valueOf(candidate.getCustomerId()))));
            }
        }
        return true;
    }

    private void advanceActive(SweepSummary summary, Set<UUID> aborted, Map<UUID, Optional<Journey>> journeys) {
        for (JourneyEnrollment enrollment : enrollmentStore.findActive()) {
            if (checkCancelled(summary)) {
                return;
            }
            Optional<Journey> journey = runnableJourney(enrollment, aborted, journeys);
            if (journey.isEmpty()) {
                summary.incrementSkipped();
                continue;
            }
            try {
                AdvanceResult result = walker.advance(journey.get(), enrollment, WalkMode.LIVE);
                if (result.isLostRace()) {
                    summary.incrementSkipped();
                } else {
                    summary.incrementAdvanced();
                }
            } catch (Exception e) {
                enrollmentError(summary, enrollment, "Failed to advance enrollment", e);
            }
        }
    }

    private void resumeWaiting(SweepSummary summary, Set<UUID> aborted, Map<UUID, Optional<Journey>> journeys) {
        for (JourneyEnrollment enrollment : enrollmentStore.findWaitingDue(clock.instant())) {
            if (checkCancelled(summary)) {
                return;
            }
            Optional<Journey> journey = runnableJourney(enrollment, aborted, journeys);
            if (journey.isEmpty() || enrollment.getWaitingForEvent() == null) {
                summary.incrementSkipped();
                continue;
            }
            try {
                Optional<AdvanceResult> result = switch (enrollment.getWaitingForEvent().getType()) {
                    case TIMER -> Optional.of(walker.resumeTimer(journey.get(), enrollment));
                    case ENGAGEMENT_WAIT -> exitPathRouter.handleEngagementTimeout(journey.get(), enrollment);
                    case MESSAGE_CALLBACK -> Optional.empty();
                };
                if (result.isPresent() && !result.get().isLostRace()) {
                    summary.incrementResumed();
                } else {
                    summary.incrementSkipped();
                }
            } catch (Exception e) {
                enrollmentError(summary, enrollment, "Failed to resume enrollment", e);
            }
        }
    }

    /**
     * The enrollment's journey, if its enrollments may move on this sweep.
     */
    private Optional<Journey> runnableJourney(JourneyEnrollment enrollment, Set<UUID> aborted,
                                              Map<UUID, Optional<Journey>> journeys) {
        if (aborted.contains(enrollment.getJourneyId())) {
            return Optional.empty();
        }
        Optional<Journey> journey = journeys.computeIfAbsent(enrollment.getJourneyId(), journeyRepository::findById);
        if (journey.isEmpty() || !journey.get().isActive() || !takesPart(journey.get())) {
            log.debug("Enrollment's journey is not runnable: enrollmentId={}, journeyId={}",
                    enrollment.getId(), enrollment.getJourneyId());
            return Optional.empty();
        }
        return journey;
    }

    private boolean takesPart(Journey journey) {
        return !journey.effectiveSettings().isTestMode() || properties.getSweep().isIncludeTestJourneys();
    }

    private void enrollmentError(SweepSummary summary, JourneyEnrollment enrollment, String message, Exception e) {
        log.error("{}: enrollmentId={}, journeyId={}, customerId={}, nodeId={}, error={}", message,
                enrollment.getId(), enrollment.getJourneyId(), enrollment.getCustomerId(),
                enrollment.getCurrentNodeId(), e.getMessage(), e);
        summary.addIssue(EngineIssue.error(message + ": " + e.getMessage(), Map.of(
                "enrollmentId", String.valueOf(enrollment.getId()),
                "journeyId", String.valueOf(enrollment.getJourneyId()),
                "customerId", String.valueOf(enrollment.getCustomerId()),
                "nodeId", String.valueOf(enrollment.getCurrentNodeId()))));
    }

    private boolean checkCancelled(SweepSummary summary) {
        if (cancelRequested.get() || shuttingDown.get() || Thread.currentThread().isInterrupted()) {
            if (!summary.isCancelled()) {
                log.warn("Sweep cancelled, stopping at the next boundary");
            }
            summary.setCancelled(true);
            return true;
        }
        return false;
    }

    private SweepSummary decline(SweepSummary summary) {
        summary.setDeclined(true);
        summary.setFinishedAt(clock.instant());
        return summary;
    }
}
