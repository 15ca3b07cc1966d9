package com.journeytide.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ManualEnrollmentRequest {

    @NotBlank(message = "customerId is required")
    private String customerId;

    /** Optional; looked up on the customer profile when absent. */
    private String phone;
}
