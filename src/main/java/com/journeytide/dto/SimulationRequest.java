package com.journeytide.dto;

import lombok.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Example JSON:
 * {
 *   "customerIds": ["cust-42"],
 *   "phoneNumbers": ["+15551234567"]
 * }
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class SimulationRequest {

    @Builder.Default
    private List<String> customerIds = new ArrayList<>();

    @Builder.Default
    private List<String> phoneNumbers = new ArrayList<>();
}
