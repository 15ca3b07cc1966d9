package com.journeytide.model.graph;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A single mutation of a customer profile property, e.g.
 *   {"property": "interest", "operation": "append", "value": "sneakers"}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@Getter @Setter @NoArgsConstructor @AllArgsConstructor
public class ProfileUpdate {

    private String property;

    private ProfileOperation operation;

    private Object value;
}
