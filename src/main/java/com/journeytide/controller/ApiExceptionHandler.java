package com.journeytide.controller;

import com.journeytide.dto.ApiError;
import com.journeytide.service.JourneyValidationException;
import jakarta.persistence.EntityNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Maps service exceptions to ApiError responses.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(EntityNotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(EntityNotFoundException e, HttpServletRequest request) {
        log.debug("Not found: {}", e.getMessage());
        return build(HttpStatus.NOT_FOUND, e.getMessage(), List.of(), request);
    }

    @ExceptionHandler(JourneyValidationException.class)
    public ResponseEntity<ApiError> handleInvalidJourney(JourneyValidationException e, HttpServletRequest request) {
        log.warn("Journey rejected: {}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Journey graph is invalid", e.getProblems(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException e, HttpServletRequest request) {
        List<String> details = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.toList());
        log.warn("Validation failed: {}", details);
        return build(HttpStatus.BAD_REQUEST, "Request validation failed", details, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException e, HttpServletRequest request) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Malformed request body", List.of(), request);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiError> handleIllegalState(IllegalStateException e, HttpServletRequest request) {
        log.warn("Invalid state: {}", e.getMessage());
        return build(HttpStatus.CONFLICT, e.getMessage(), List.of(), request);
    }

    private ResponseEntity<ApiError> build(HttpStatus status, String message, List<String> details,
                                           HttpServletRequest request) {
        ApiError error = ApiError.builder()
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(message)
                .path(request.getRequestURI())
                .details(details)
                .timestamp(Instant.now())
                .build();
        return ResponseEntity.status(status).body(error);
    }
}
