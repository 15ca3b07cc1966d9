package com.journeytide.dto;

import com.journeytide.model.JourneyStatus;
import jakarta.validation.constraints.NotNull;
import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor
public class StatusChangeRequest {

    @NotNull(message = "status is required")
    private JourneyStatus status;
}
