package com.vitalscan.assessment.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.vitalscan.assessment.domain.PatientRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The page layouts the patient service is known to return. {@link #resolve(JsonNode)} picks one
 * and {@link #records()} flattens it to records carrying a patient id.
 */
public sealed interface PageBody {

    JsonNode root();

    List<JsonNode> candidates();

    static PageBody resolve(JsonNode root) {
        if (root == null || !root.isObject()) {
            return new Unrecognized(root);
        }
        JsonNode data = root.get("data");
        if (data != null && data.isArray()) {
            return new RecordArray(root, data);
        }
        if (data != null && data.isObject()) {
            return new RecordMap(root, data);
        }
        JsonNode patients = root.get("patients");
        if (patients != null && patients.isArray()) {
            return new AlternateArray(root, patients);
        }
        return new Unrecognized(root);
    }

    default List<PatientRecord> records() {
        List<PatientRecord> records = new ArrayList<>();
        for (JsonNode candidate : candidates()) {
            PatientRecord.from(candidate).ifPresent(records::add);
        }
        return records;
    }

    /**
     * {@code pagination.hasNext} when the service sends it as a boolean.
     */
    default Optional<Boolean> hasNext() {
        if (root() == null) {
            return Optional.empty();
        }
        JsonNode flag = root().path("pagination").path("hasNext");
        return flag.isBoolean() ? Optional.of(flag.booleanValue()) : Optional.empty();
    }

    /** {@code {"data": [ {...}, ... ]}} */
    record RecordArray(JsonNode root, JsonNode data) implements PageBody {
        @Override
        public List<JsonNode> candidates() {
            List<JsonNode> out = new ArrayList<>(data.size());
            data.forEach(out::add);
            return out;
        }
    }

    /** {@code {"data": {"k1": {...}, "k2": {...}}}}, values without a patient id are ignored. */
    record RecordMap(JsonNode root, JsonNode data) implements PageBody {
        @Override
        public List<JsonNode> candidates() {
            List<JsonNode> out = new ArrayList<>(data.size());
            data.elements().forEachRemaining(value -> {
                if (value.hasNonNull(PatientRecord.PATIENT_ID)) {
                    out.add(value);
                }
            });
            return out;
        }
    }

    /** {@code {"patients": [ {...}, ... ]}} */
    record AlternateArray(JsonNode root, JsonNode patients) implements PageBody {
        @Override
        public List<JsonNode> candidates() {
            List<JsonNode> out = new ArrayList<>(patients.size());
            patients.forEach(out::add);
            return out;
        }
    }

    record Unrecognized(JsonNode root) implements PageBody {
        @Override
        public List<JsonNode> candidates() {
            return List.of();
        }
    }
}
