package com.vitalscan.assessment.scoring;

import com.vitalscan.assessment.domain.ParsedVitals;
import com.vitalscan.assessment.domain.RiskScore;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import org.springframework.stereotype.Component;

/**
 * Fixed clinical thresholds. A field that failed to parse contributes 0 to the total.
 */
@Component
public class RiskScorer {

    public static final double FEVER_THRESHOLD = 99.6;

    public RiskScore score(ParsedVitals vitals) {
        return new RiskScore(
            bloodPressureScore(vitals.systolic(), vitals.diastolic()),
            temperatureScore(vitals.temperature()),
            ageScore(vitals.age())
        );
    }

    /**
     * Bands are checked in order and the first match wins; they overlap, e.g. 125/85 lands in the
     * 80-89 diastolic band because the elevated band needs diastolic under 80.
     */
    public int bloodPressureScore(OptionalInt systolic, OptionalInt diastolic) {
        if (systolic.isEmpty() || diastolic.isEmpty()) {
            return 0;
        }
        int sys = systolic.getAsInt();
        int dia = diastolic.getAsInt();
        if (sys < 120 && dia < 80) {
            return 1;
        }
        if (sys >= 120 && sys <= 129 && dia < 80) {
            return 2;
        }
        if ((sys >= 130 && sys <= 139) || (dia >= 80 && dia <= 89)) {
            return 3;
        }
        if (sys >= 140 || dia >= 90) {
            return 4;
        }
        return 0;
    }

    public int temperatureScore(OptionalDouble temperature) {
        if (temperature.isEmpty()) {
            return 0;
        }
        double t = temperature.getAsDouble();
        if (t <= 99.5) {
            return 0;
        }
        if (t >= 99.6 && t <= 100.9) {
            return 1;
        }
        if (t >= 101.0) {
            return 2;
        }
        // 99.5 < t < 99.6 and 100.9 < t < 101.0 fall between bands
        return 0;
    }

    public int ageScore(OptionalInt age) {
        if (age.isEmpty()) {
            return 0;
        }
        int a = age.getAsInt();
        if (a < 40) {
            return 1;
        }
        if (a <= 65) {
            return 1;
        }
        return 2;
    }

    public boolean isFever(OptionalDouble temperature) {
        return temperature.isPresent() && temperature.getAsDouble() >= FEVER_THRESHOLD;
    }
}
