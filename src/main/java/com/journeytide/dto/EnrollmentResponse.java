package com.journeytide.dto;

import com.journeytide.model.EnrollmentStatus;
import com.journeytide.model.ExperimentAssignment;
import com.journeytide.model.WaitType;
import lombok.*;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class EnrollmentResponse {
    private UUID id;
    private UUID journeyId;
    private String customerId;
    private String customerPhone;
    private String currentNodeId;
    private EnrollmentStatus status;
    private String exitReason;
    private WaitType waitingFor;
    private Instant waitingUntil;
    private Map<String, Object> metadata;
    private Map<String, ExperimentAssignment> experiments;
    private Instant startedAt;
    private Instant lastActivityAt;
    private Instant completedAt;
}
