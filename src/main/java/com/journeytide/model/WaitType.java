package com.journeytide.model;

/**
 * What a WAITING enrollment is waiting for.
 */
public enum WaitType {
    /** A delay node; the sweep resumes it once timeoutAt passes. */
    TIMER,
    /** A sent message; only a status or reply callback moves it. */
    MESSAGE_CALLBACK,
    /** A "wait" exit path after a read receipt; times out to metadata.timeoutPath. */
    ENGAGEMENT_WAIT
}
