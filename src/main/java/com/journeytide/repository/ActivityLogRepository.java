package com.journeytide.repository;

import com.journeytide.model.ActivityLogEntry;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface ActivityLogRepository extends JpaRepository<ActivityLogEntry, UUID> {

    List<ActivityLogEntry> findByEnrollmentIdOrderByTimestampAsc(UUID enrollmentId);
}
