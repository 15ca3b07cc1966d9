package com.journeytide.model.graph;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry and re-entry policy of a journey, stored as JSON on the journey row.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class JourneySettings {

    private boolean allowReentry;

    /** Null or zero means re-entry is allowed as soon as the previous run finished. */
    private Integer reentryCooldownDays;

    private boolean testMode;

    @Builder.Default
    private List<String> testPhoneNumbers = new ArrayList<>();

    @Builder.Default
    private List<String> testCustomerIds = new ArrayList<>();

    @Builder.Default
    private Entry entry = new Entry();

    @JsonIgnoreProperties(ignoreUnknown = true)
    @Getter @Setter @NoArgsConstructor @AllArgsConstructor
    public static class Entry {
        private String segmentId;
    }
}
