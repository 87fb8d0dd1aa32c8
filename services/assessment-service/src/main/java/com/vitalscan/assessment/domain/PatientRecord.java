package com.vitalscan.assessment.domain;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;

/**
 * One patient as delivered by the remote service. Only {@code patient_id} is required;
 * the rest of the payload is kept as-is in {@link #raw()}.
 */
public record PatientRecord(String patientId, JsonNode raw) {

    public static final String PATIENT_ID = "patient_id";
    public static final String BLOOD_PRESSURE = "blood_pressure";
    public static final String TEMPERATURE = "temperature";
    public static final String AGE = "age";

    public static Optional<PatientRecord> from(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        JsonNode id = node.get(PATIENT_ID);
        if (id == null || !(id.isTextual() || id.isNumber())) {
            return Optional.empty();
        }
        String text = id.asText("").trim();
        if (text.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new PatientRecord(text, node));
    }

    public JsonNode bloodPressure() {
        return raw.get(BLOOD_PRESSURE);
    }

    public JsonNode temperature() {
        return raw.get(TEMPERATURE);
    }

    public JsonNode age() {
        return raw.get(AGE);
    }
}
