package com.journeytide.repository;

import com.journeytide.model.EnrollmentStatus;
import com.journeytide.model.JourneyEnrollment;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Database access for enrollments.
 *
 * findByStatusAndWaitingForEventTimeoutAtLessThanEqual(WAITING, now)
 * → SELECT * FROM journey_enrollments WHERE status = 'WAITING' AND waiting_timeout_at <= ?
 */
public interface JourneyEnrollmentRepository extends JpaRepository<JourneyEnrollment, UUID> {

    // Used by enrollment: every previous run of this customer in this journey
    List<JourneyEnrollment> findByJourneyIdAndCustomerId(UUID journeyId, String customerId);

    boolean existsByJourneyIdAndCustomerIdAndStatusIn(UUID journeyId, String customerId,
                                                      Collection<EnrollmentStatus> statuses);

    List<JourneyEnrollment> findByStatus(EnrollmentStatus status);

    List<JourneyEnrollment> findByStatusAndWaitingForEventTimeoutAtLessThanEqual(EnrollmentStatus status,
                                                                                 Instant cutoff);

    // Used by the callback router: the enrollment that sent this message
    Optional<JourneyEnrollment> findFirstByExternalMessageIdOrderByStartedAtDesc(String externalMessageId);

    List<JourneyEnrollment> findByJourneyIdOrderByStartedAtDesc(UUID journeyId);
}
