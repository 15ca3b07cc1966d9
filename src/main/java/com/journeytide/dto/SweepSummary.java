package com.journeytide.dto;

import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one engine sweep.
 *
 * Example JSON:
 * {
 *   "startedAt": "2024-05-01T10:00:00Z",
 *   "finishedAt": "2024-05-01T10:00:04Z",
 *   "journeysProcessed": 3,
 *   "enrollmentsCreated": 12,
 *   "enrollmentsAdvanced": 5,
 *   "enrollmentsResumed": 2,
 *   "skipped": 40,
 *   "declined": false,
 *   "cancelled": false,
 *   "errors": []
 * }
 *
 * declined means another sweep was already running and this one did nothing.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class SweepSummary {

    private Instant startedAt;
    private Instant finishedAt;
    private int journeysProcessed;
    private int enrollmentsCreated;
    private int enrollmentsAdvanced;
    private int enrollmentsResumed;
    private int skipped;
    private boolean declined;
    private boolean cancelled;

    @Builder.Default
    private List<EngineIssue> errors = new ArrayList<>();

    public void addIssue(EngineIssue issue) {
        errors.add(issue);
    }

    public void addIssues(List<EngineIssue> issues) {
        errors.addAll(issues);
    }

    public void incrementJourneysProcessed() {
        journeysProcessed++;
    }

    public void incrementCreated() {
        enrollmentsCreated++;
    }

    public void incrementAdvanced() {
        enrollmentsAdvanced++;
    }

    public void incrementResumed() {
        enrollmentsResumed++;
    }

    public void incrementSkipped() {
        skipped++;
    }
}
