package com.journeytide.service;

/**
 * Why a candidate was not enrolled. Skips are normal outcomes, not errors.
 */
public enum SkipReason {
    JOURNEY_NOT_ACTIVE,
    NO_TRIGGER_NODE,
    /** An ACTIVE or WAITING enrollment already exists. */
    ALREADY_ENROLLED,
    REENTRY_NOT_ALLOWED,
    COOLDOWN_NOT_ELAPSED,
    TEST_MODE_EXCLUDED,
    /** Another worker holds the enrollment lease for this customer. */
    CONCURRENT_ENROLLMENT,
    /** The first walk lost an optimistic-lock race. */
    LOST_RACE
}
