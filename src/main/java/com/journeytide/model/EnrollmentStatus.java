package com.journeytide.model;

/**
 * Where a single enrollment stands in its walk through a journey.
 *
 *   ACTIVE    → the next sweep walks it from currentNodeId
 *   WAITING   → parked on a delay or send node until a timer or callback
 *   COMPLETED → reached a goal node
 *   EXITED    → reached an exit node, an exit path, or the end of a path
 *   FAILED    → stopped on a graph, config or gateway error
 */
public enum EnrollmentStatus {
    ACTIVE,
    WAITING,
    COMPLETED,
    EXITED,
    FAILED;

    /** ACTIVE and WAITING enrollments block a second enrollment in the same journey. */
    public boolean isOpen() {
        return this == ACTIVE || this == WAITING;
    }

    public boolean isTerminal() {
        return !isOpen();
    }

    /** Finished enrollments that count against re-entry. FAILED ones never do. */
    public boolean blocksReentry() {
        return this == COMPLETED || this == EXITED;
    }
}
