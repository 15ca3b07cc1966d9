package com.journeytide.service;

import lombok.Getter;

import java.util.List;

/**
 * A journey graph that cannot be activated.
 */
@Getter
public class JourneyValidationException extends RuntimeException {

    private final List<String> problems;

    public JourneyValidationException(List<String> problems) {
        super("Invalid journey: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }
}
