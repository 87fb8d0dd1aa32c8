package com.vitalscan.assessment.domain;

import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Vitals of one record after tolerant parsing. An empty optional means the field could not be
 * parsed; it is never folded into zero.
 */
public record ParsedVitals(
    OptionalInt systolic,
    OptionalInt diastolic,
    OptionalDouble temperature,
    OptionalInt age
) {

    public boolean hasInvalidField() {
        return systolic.isEmpty() || diastolic.isEmpty() || temperature.isEmpty() || age.isEmpty();
    }
}
