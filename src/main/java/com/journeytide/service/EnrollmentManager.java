package com.journeytide.service;

import com.journeytide.config.JourneyEngineProperties;
import com.journeytide.model.ActivityLogEntry;
import com.journeytide.model.CustomerProfile;
import com.journeytide.model.Journey;
import com.journeytide.model.JourneyEnrollment;
import com.journeytide.model.graph.JourneySettings;
import com.journeytide.model.graph.TriggerNode;
import com.journeytide.repository.CustomerProfileRepository;
import com.journeytide.repository.JourneyRepository;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Decides whether a customer may enter a journey and, if so, creates the
 * enrollment and runs its first walk.
 *
 * Gates, in order:
 *   1. journey is ACTIVE and has a trigger node
 *   2. no ACTIVE/WAITING enrollment for (journey, customer)
 *   3. a finished (COMPLETED/EXITED) run blocks unless re-entry is allowed and
 *      the cooldown since the latest one has elapsed; FAILED runs never block
 *   4. test-mode journeys only admit the test audience
 *
 * Live creation holds a short Redis lease on (journey, customer) so two
 * engine instances cannot both pass the gates for the same customer.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EnrollmentManager {

    private final EnrollmentStore enrollmentStore;
    private final NodeGraphWalker walker;
    private final LeaseService leaseService;
    private final JourneyRepository journeyRepository;
    private final CustomerProfileRepository customerProfileRepository;
    private final JourneyEngineProperties properties;
    private final Clock clock;

    public EnrollmentOutcome tryEnroll(Journey journey, EnrollmentCandidate candidate, WalkMode mode) {
        Optional<SkipReason> rejected = checkEligibility(journey, candidate);
        if (rejected.isPresent()) {
            log.debug("Enrollment skipped: journeyId={}, customerId={}, reason={}",
                    journey.getId(), candidate.getCustomerId(), rejected.get());
            return EnrollmentOutcome.skipped(rejected.get());
        }
        TriggerNode trigger = journey.findTriggerNode().orElseThrow();

        if (mode == WalkMode.DRY_RUN) {
            JourneyEnrollment transientEnrollment = start(journey, candidate, trigger);
            List<ActivityLogEntry> entries = List.of(started(transientEnrollment));
            return EnrollmentOutcome.enrolled(walker.advance(journey, transientEnrollment, WalkMode.DRY_RUN, entries));
        }

        String leaseKey = LeaseService.enrollmentKey(journey.getId(), candidate.getCustomerId());
        Duration leaseTtl = Duration.ofSeconds(properties.getSweep().getEnrollmentLeaseSeconds());
        Optional<String> lease = leaseService.acquire(leaseKey, leaseTtl);
        if (lease.isEmpty()) {
            log.info("Enrollment skipped, lease held elsewhere: journeyId={}, customerId={}",
                    journey.getId(), candidate.getCustomerId());
            return EnrollmentOutcome.skipped(SkipReason.CONCURRENT_ENROLLMENT);
        }

        try {
            // another instance may have enrolled between the first check and the lease
            Optional<SkipReason> recheck = checkPriorEnrollments(journey, candidate.getCustomerId());
            if (recheck.isPresent()) {
                return EnrollmentOutcome.skipped(recheck.get());
            }

            JourneyEnrollment enrollment = start(journey, candidate, trigger);
            JourneyEnrollment saved = enrollmentStore.save(enrollment, List.of(started(enrollment)));
            log.info("Enrollment created: enrollmentId={}, journeyId={}, customerId={}",
                    saved.getId(), journey.getId(), candidate.getCustomerId());

            AdvanceResult result = walker.advance(journey, saved, WalkMode.LIVE);
            if (result.isLostRace()) {
                return EnrollmentOutcome.skipped(SkipReason.LOST_RACE);
            }
            return EnrollmentOutcome.enrolled(result);
        } finally {
            leaseService.release(leaseKey, lease.get());
        }
    }

    /**
     * Entry point for manual_entry journeys; works for any ACTIVE journey.
     */
    public EnrollmentOutcome enrollManually(UUID journeyId, String customerId, String phone) {
        Journey journey = journeyRepository.findById(journeyId)
                .orElseThrow(() -> new EntityNotFoundException("Journey not found: " + journeyId));
        String resolvedPhone = phone;
        if (resolvedPhone == null || resolvedPhone.isBlank()) {
            resolvedPhone = customerProfileRepository.findById(customerId)
                    .map(CustomerProfile::getPhone)
                    .orElse(null);
        }
        log.info("Manual enrollment requested: journeyId={}, customerId={}", journeyId, customerId);
        return tryEnroll(journey, new EnrollmentCandidate(customerId, resolvedPhone), WalkMode.LIVE);
    }

    public Optional<SkipReason> checkEligibility(Journey journey, EnrollmentCandidate candidate) {
        if (!journey.isActive()) {
            return Optional.of(SkipReason.JOURNEY_NOT_ACTIVE);
        }
        if (journey.findTriggerNode().isEmpty()) {
            return Optional.of(SkipReason.NO_TRIGGER_NODE);
        }
        Optional<SkipReason> prior = checkPriorEnrollments(journey, candidate.getCustomerId());
        if (prior.isPresent()) {
            return prior;
        }
        JourneySettings settings = journey.effectiveSettings();
        if (settings.isTestMode() && !isTestAudience(settings, candidate)) {
            return Optional.of(SkipReason.TEST_MODE_EXCLUDED);
        }
        return Optional.empty();
    }

    private Optional<SkipReason> checkPriorEnrollments(Journey journey, String customerId) {
        List<JourneyEnrollment> prior = enrollmentStore.findByJourneyAndCustomer(journey.getId(), customerId);
        if (prior.stream().anyMatch(e -> e.getStatus() != null && e.getStatus().isOpen())) {
            return Optional.of(SkipReason.ALREADY_ENROLLED);
        }

        Optional<Instant> latestFinish = prior.stream()
                .filter(e -> e.getStatus() != null && e.getStatus().blocksReentry())
                .map(JourneyEnrollment::finishedAt)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder());
        boolean hasFinished = prior.stream().anyMatch(e -> e.getStatus() != null && e.getStatus().blocksReentry());
        if (!hasFinished) {
            return Optional.empty();
        }

        JourneySettings settings = journey.effectiveSettings();
        if (!settings.isAllowReentry()) {
            return Optional.of(SkipReason.REENTRY_NOT_ALLOWED);
        }
        Integer cooldownDays = settings.getReentryCooldownDays();
        if (cooldownDays != null && cooldownDays > 0 && latestFinish.isPresent()) {
            Instant eligibleAt = latestFinish.get().plus(Duration.ofDays(cooldownDays));
            if (clock.instant().isBefore(eligibleAt)) {
                return Optional.of(SkipReason.COOLDOWN_NOT_ELAPSED);
            }
        }
        return Optional.empty();
    }

    private boolean isTestAudience(JourneySettings settings, EnrollmentCandidate candidate) {
        JourneyEngineProperties.Test global = properties.getTest();
        if (contains(settings.getTestCustomerIds(), candidate.getCustomerId())
                || contains(global.getCustomerIds(), candidate.getCustomerId())) {
            return true;
        }
        String phone = digits(candidate.getPhone());
        if (phone == null || phone.isEmpty()) {
            return false;
        }
        return matchesPhone(settings.getTestPhoneNumbers(), phone) || matchesPhone(global.getPhoneNumbers(), phone);
    }

    private static boolean contains(List<String> values, String value) {
        return values != null && value != null && values.contains(value);
    }

    private static boolean matchesPhone(List<String> phones, String digits) {
        return phones != null && phones.stream().map(EnrollmentManager::digits).anyMatch(digits::equals);
    }

    private static String digits(String phone) {
        return phone == null ? null : phone.replaceAll("[^0-9]", "");
    }

    private JourneyEnrollment start(Journey journey, EnrollmentCandidate candidate, TriggerNode trigger) {
        return JourneyEnrollment.start(journey.getId(), candidate.getCustomerId(), candidate.getPhone(),
                trigger.getId(), clock.instant());
    }

    private ActivityLogEntry started(JourneyEnrollment enrollment) {
        return ActivityLogEntry.of(enrollment, enrollment.getCurrentNodeId(), "journey_started",
                Map.of("customerId", enrollment.getCustomerId()), clock.instant());
    }
}
