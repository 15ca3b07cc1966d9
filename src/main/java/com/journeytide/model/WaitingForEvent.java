package com.journeytide.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * The event a WAITING enrollment is parked on. A null timeoutAt means the
 * enrollment never times out on its own.
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class WaitingForEvent {

    @Enumerated(EnumType.STRING)
    @Column(name = "waiting_event_type")
    private WaitType type;

    @Column(name = "waiting_timeout_at")
    private Instant timeoutAt;

    public static WaitingForEvent timer(Instant resumeAt) {
        return new WaitingForEvent(WaitType.TIMER, resumeAt);
    }

    public static WaitingForEvent messageCallback() {
        return new WaitingForEvent(WaitType.MESSAGE_CALLBACK, null);
    }

    public static WaitingForEvent engagementWait(Instant timeoutAt) {
        return new WaitingForEvent(WaitType.ENGAGEMENT_WAIT, timeoutAt);
    }

    public boolean hasElapsed(Instant now) {
        return timeoutAt != null && !timeoutAt.isAfter(now);
    }
}
