package com.vitalscan.assessment.domain;

public record RiskScore(int bloodPressure, int temperature, int age) {

    public static final int HIGH_RISK_THRESHOLD = 4;

    public int total() {
        return bloodPressure + temperature + age;
    }

    public boolean isHighRisk() {
        return total() >= HIGH_RISK_THRESHOLD;
    }
}
