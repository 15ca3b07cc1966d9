package com.journeytide.dto;

import com.journeytide.model.EnrollmentStatus;
import com.journeytide.model.WaitType;
import com.journeytide.service.SkipReason;
import lombok.*;

import java.util.List;
import java.util.UUID;

/**
 * Dry-run report for a journey: who would enter and where each walk would stop.
 * Nothing is persisted and no message is sent while producing it.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class SimulationResult {

    private UUID journeyId;
    private String journeyName;
    private List<SimulatedCustomer> customers;
    private String message;

    @Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
    public static class SimulatedCustomer {
        private String customerId;
        private String phone;
        private boolean eligible;
        private SkipReason skipReason;
        /** Node ids the walk would execute, in order. */
        private List<String> path;
        private EnrollmentStatus finalStatus;
        private String finalNodeId;
        private WaitType waitingFor;
        private String exitReason;
    }
}
