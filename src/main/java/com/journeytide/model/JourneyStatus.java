package com.journeytide.model;

/**
 * Lifecycle of a journey definition. Only ACTIVE journeys take part in sweeps
 * and accept new enrollments.
 */
public enum JourneyStatus {
    DRAFT,
    ACTIVE,
    PAUSED
}
