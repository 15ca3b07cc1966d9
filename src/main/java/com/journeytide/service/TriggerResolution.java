package com.journeytide.service;

import com.journeytide.dto.EngineIssue;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@Getter
@AllArgsConstructor
public class TriggerResolution {

    private final List<EnrollmentCandidate> candidates;

    /** Non-fatal problems, e.g. a segment that no longer exists. */
    private final List<EngineIssue> issues;

    public static TriggerResolution empty() {
        return new TriggerResolution(List.of(), List.of());
    }

    public static TriggerResolution of(List<EnrollmentCandidate> candidates) {
        return new TriggerResolution(candidates, List.of());
    }

    public static TriggerResolution withIssue(EngineIssue issue) {
        return new TriggerResolution(List.of(), List.of(issue));
    }
}
