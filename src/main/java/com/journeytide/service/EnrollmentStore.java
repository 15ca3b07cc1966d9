package com.journeytide.service;

import com.journeytide.model.ActivityLogEntry;
import com.journeytide.model.JourneyEnrollment;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence port for enrollments and their activity log.
 *
 * save() writes the activity entries and the enrollment state in one unit;
 * a stale enrollment version makes the whole write fail with an
 * OptimisticLockingFailureException and nothing is persisted.
 */
public interface EnrollmentStore {

    Optional<JourneyEnrollment> findById(UUID enrollmentId);

    List<JourneyEnrollment> findByJourneyAndCustomer(UUID journeyId, String customerId);

    List<JourneyEnrollment> findActive();

    /** WAITING enrollments whose timeoutAt is at or before the cutoff. */
    List<JourneyEnrollment> findWaitingDue(Instant cutoff);

    Optional<JourneyEnrollment> findByExternalMessageId(String externalMessageId);

    List<JourneyEnrollment> findByJourney(UUID journeyId);

    JourneyEnrollment save(JourneyEnrollment enrollment, List<ActivityLogEntry> entries);
}
