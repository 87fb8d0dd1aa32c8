package com.vitalscan.assessment.domain;

import java.util.OptionalInt;

public record BloodPressureReading(OptionalInt systolic, OptionalInt diastolic) {

    public static BloodPressureReading invalid() {
        return new BloodPressureReading(OptionalInt.empty(), OptionalInt.empty());
    }
}
