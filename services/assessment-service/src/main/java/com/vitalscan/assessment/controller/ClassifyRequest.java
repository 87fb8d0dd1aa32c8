package com.vitalscan.assessment.controller;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;

public record ClassifyRequest(
    @NotEmpty(message = "records must not be empty")
    List<JsonNode> records
) {
}
