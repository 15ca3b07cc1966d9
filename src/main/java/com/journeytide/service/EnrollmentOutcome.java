package com.journeytide.service;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EnrollmentOutcome {

    private final boolean enrolled;

    private final SkipReason skipReason;

    /** The first walk of the new enrollment; null when skipped. */
    private final AdvanceResult advance;

    public static EnrollmentOutcome enrolled(AdvanceResult advance) {
        return new EnrollmentOutcome(true, null, advance);
    }

    public static EnrollmentOutcome skipped(SkipReason reason) {
        return new EnrollmentOutcome(false, reason, null);
    }
}
