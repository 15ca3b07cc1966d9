package com.journeytide.service;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * A customer the trigger resolver proposes for enrollment.
 */
@Getter
@AllArgsConstructor
public class EnrollmentCandidate {

    private final String customerId;

    private final String phone;
}
