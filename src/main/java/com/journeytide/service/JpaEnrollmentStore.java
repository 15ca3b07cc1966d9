package com.journeytide.service;

import com.journeytide.model.ActivityLogEntry;
import com.journeytide.model.EnrollmentStatus;
import com.journeytide.model.JourneyEnrollment;
import com.journeytide.repository.ActivityLogRepository;
import com.journeytide.repository.JourneyEnrollmentRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Component
@RequiredArgsConstructor
public class JpaEnrollmentStore implements EnrollmentStore {

    private final JourneyEnrollmentRepository enrollmentRepository;
    private final ActivityLogRepository activityLogRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<JourneyEnrollment> findById(UUID enrollmentId) {
        return enrollmentRepository.findById(enrollmentId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<JourneyEnrollment> findByJourneyAndCustomer(UUID journeyId, String customerId) {
        return enrollmentRepository.findByJourneyIdAndCustomerId(journeyId, customerId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<JourneyEnrollment> findActive() {
        return enrollmentRepository.findByStatus(EnrollmentStatus.ACTIVE);
    }

    @Override
    @Transactional(readOnly = true)
    public List<JourneyEnrollment> findWaitingDue(Instant cutoff) {
        return enrollmentRepository.findByStatusAndWaitingForEventTimeoutAtLessThanEqual(
                EnrollmentStatus.WAITING, cutoff);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<JourneyEnrollment> findByExternalMessageId(String externalMessageId) {
        return enrollmentRepository.findFirstByExternalMessageIdOrderByStartedAtDesc(externalMessageId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<JourneyEnrollment> findByJourney(UUID journeyId) {
        return enrollmentRepository.findByJourneyIdOrderByStartedAtDesc(journeyId);
    }

    @Override
    @Transactional
    public JourneyEnrollment save(JourneyEnrollment enrollment, List<ActivityLogEntry> entries) {
        if (entries != null && !entries.isEmpty()) {
            activityLogRepository.saveAll(entries);
        }
        // saveAndFlush so a version conflict surfaces here, inside the transaction
        return enrollmentRepository.saveAndFlush(enrollment);
    }
}
