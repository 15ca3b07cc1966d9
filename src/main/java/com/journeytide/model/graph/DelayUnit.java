package com.journeytide.model.graph;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

public enum DelayUnit {
    @JsonProperty("seconds") SECONDS,
    @JsonProperty("minutes") MINUTES,
    @JsonProperty("hours") HOURS,
    @JsonProperty("days") DAYS,
    @JsonProperty("weeks") WEEKS;

    public Duration toDuration(long amount) {
        return switch (this) {
            case SECONDS -> Duration.ofSeconds(amount);
            case MINUTES -> Duration.ofMinutes(amount);
            case HOURS -> Duration.ofHours(amount);
            case DAYS -> Duration.ofDays(amount);
            case WEEKS -> Duration.ofDays(amount * 7);
        };
    }
}
