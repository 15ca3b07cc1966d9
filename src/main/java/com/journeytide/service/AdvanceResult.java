package com.journeytide.service;

import com.journeytide.model.ActivityLogEntry;
import com.journeytide.model.EnrollmentStatus;
import com.journeytide.model.JourneyEnrollment;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Where a walk stopped. For LIVE walks the enrollment is the persisted copy
 * unless lostRace is set, in which case nothing was written.
 */
@Getter
@AllArgsConstructor
public class AdvanceResult {

    private final JourneyEnrollment enrollment;

    private final WalkMode mode;

    /** Node ids executed, in order. */
    private final List<String> path;

    private final List<ActivityLogEntry> entries;

    private final boolean lostRace;

    public EnrollmentStatus getStatus() {
        return enrollment.getStatus();
    }
}
