package com.journeytide.dto;

import lombok.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A problem met during a sweep or callback batch, reported instead of thrown.
 *
 * Example JSON:
 * {
 *   "level": "ERROR",
 *   "message": "Journey has no trigger node",
 *   "context": {"journeyId": "a1b2..."}
 * }
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class EngineIssue {

    public enum Level { WARN, ERROR }

    private Level level;
    private String message;
    private Map<String, String> context;

    public static EngineIssue warn(String message, Map<String, String> context) {
        return new EngineIssue(Level.WARN, message, new LinkedHashMap<>(context));
    }

    public static EngineIssue error(String message, Map<String, String> context) {
        return new EngineIssue(Level.ERROR, message, new LinkedHashMap<>(context));
    }
}
