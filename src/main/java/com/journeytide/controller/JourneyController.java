package com.journeytide.controller;

import com.journeytide.dto.EnrollmentResponse;
import com.journeytide.dto.JourneyRequest;
import com.journeytide.dto.JourneyResponse;
import com.journeytide.dto.ManualEnrollmentRequest;
import com.journeytide.dto.ManualEnrollmentResponse;
import com.journeytide.dto.SimulationRequest;
import com.journeytide.dto.SimulationResult;
import com.journeytide.dto.StatusChangeRequest;
import com.journeytide.dto.SweepSummary;
import com.journeytide.service.EnrollmentManager;
import com.journeytide.service.EnrollmentOutcome;
import com.journeytide.service.JourneyEngine;
import com.journeytide.service.JourneyService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/journeys")
@RequiredArgsConstructor
public class JourneyController {

    private final JourneyService journeyService;
    private final JourneyEngine engine;
    private final EnrollmentManager enrollmentManager;

    @PostMapping
    public ResponseEntity<JourneyResponse> create(@Valid @RequestBody JourneyRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(journeyService.create(request));
    }

    @GetMapping
    public ResponseEntity<List<JourneyResponse>> listAll(@RequestParam(required = false) String storeId) {
        return ResponseEntity.ok(journeyService.listAll(storeId));
    }

    @GetMapping("/{id}")
    public ResponseEntity<JourneyResponse> getById(@PathVariable UUID id) {
        return ResponseEntity.ok(journeyService.getById(id));
    }

    @PutMapping("/{id}")
    public ResponseEntity<JourneyResponse> update(
            @PathVariable UUID id, @Valid @RequestBody JourneyRequest request) {
        return ResponseEntity.ok(journeyService.update(id, request));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        journeyService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PatchMapping("/{id}/status")
    public ResponseEntity<JourneyResponse> changeStatus(
            @PathVariable UUID id, @Valid @RequestBody StatusChangeRequest request) {
        return ResponseEntity.ok(journeyService.changeStatus(id, request.getStatus()));
    }

    /**
     * Runs one sweep now. 409 when another sweep is in progress.
     */
    @PostMapping("/sweep")
    public ResponseEntity<SweepSummary> sweep() {
        SweepSummary summary = engine.runSweep();
        HttpStatus status = summary.isDeclined() ? HttpStatus.CONFLICT : HttpStatus.OK;
        return ResponseEntity.status(status).body(summary);
    }

    @PostMapping("/{id}/simulate")
    public ResponseEntity<SimulationResult> simulate(
            @PathVariable UUID id, @RequestBody(required = false) SimulationRequest request) {
        SimulationRequest body = request != null ? request : new SimulationRequest();
        return ResponseEntity.ok(engine.simulate(id, body.getCustomerIds(), body.getPhoneNumbers()));
    }

    @PostMapping("/{id}/enrollments")
    public ResponseEntity<ManualEnrollmentResponse> enroll(
            @PathVariable UUID id, @Valid @RequestBody ManualEnrollmentRequest request) {
        EnrollmentOutcome outcome = enrollmentManager.enrollManually(id, request.getCustomerId(), request.getPhone());
        ManualEnrollmentResponse response = ManualEnrollmentResponse.builder()
                .enrolled(outcome.isEnrolled())
                .skipReason(outcome.getSkipReason())
                .enrollment(outcome.isEnrolled()
                        ? JourneyService.toEnrollmentResponse(outcome.getAdvance().getEnrollment())
                        : null)
                .build();
        return ResponseEntity.status(outcome.isEnrolled() ? HttpStatus.CREATED : HttpStatus.OK).body(response);
    }

    @GetMapping("/{id}/enrollments")
    public ResponseEntity<List<EnrollmentResponse>> listEnrollments(@PathVariable UUID id) {
        return ResponseEntity.ok(journeyService.listEnrollments(id));
    }
}
