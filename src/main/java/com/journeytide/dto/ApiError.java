package com.journeytide.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Standard API error response.
 */
@Value
@Builder
public class ApiError {
    int status;
    String error;
    String message;
    String path;
    List<String> details;
    Instant timestamp;
}
