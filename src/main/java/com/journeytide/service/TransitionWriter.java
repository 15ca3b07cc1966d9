package com.journeytide.service;

import com.journeytide.model.ActivityLogEntry;
import com.journeytide.model.JourneyEnrollment;
import com.journeytide.model.graph.ProfileUpdate;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Commits a callback-driven transition together with the profile updates of
 * the exit path taken. A stale enrollment version rolls both back, so the
 * profile never reflects a transition that did not happen.
 */
@Component
@RequiredArgsConstructor
public class TransitionWriter {

    private final EnrollmentStore enrollmentStore;
    private final ProfileUpdater profileUpdater;

    @Transactional
    public JourneyEnrollment commit(JourneyEnrollment enrollment, List<ActivityLogEntry> entries,
                                    List<ProfileUpdate> profileUpdates) {
        JourneyEnrollment saved = enrollmentStore.save(enrollment, entries);
        if (profileUpdates != null && !profileUpdates.isEmpty()) {
            profileUpdater.apply(enrollment.getCustomerId(), profileUpdates);
        }
        return saved;
    }
}
