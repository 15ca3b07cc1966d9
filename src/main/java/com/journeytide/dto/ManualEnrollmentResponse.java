package com.journeytide.dto;

import com.journeytide.service.SkipReason;
import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ManualEnrollmentResponse {
    private boolean enrolled;
    private SkipReason skipReason;
    private EnrollmentResponse enrollment;
}
