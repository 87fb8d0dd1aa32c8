package com.vitalscan.assessment.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.vitalscan.assessment.domain.AssessmentReport;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

@Component
public class PatientApiClient {

    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public PatientApiClient(@Qualifier("patientApiRestClient") RestClient restClient, ObjectMapper objectMapper) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
    }

    /**
     * Single GET of one page. HTTP errors surface as {@code RestClientResponseException};
     * a body that is not JSON surfaces as {@link UnusablePageException}.
     */
    public JsonNode fetchPage(int page, int limit) {
        String body = restClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/patients")
                .queryParam("page", page)
                .queryParam("limit", limit)
                .build())
            .retrieve()
            .body(String.class);

        if (body == null || body.isBlank()) {
            return MissingNode.getInstance();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new UnusablePageException("page " + page + " body is not valid JSON", e);
        }
    }

    public ResponseEntity<String> submitAssessment(AssessmentReport report) {
        return restClient.post()
            .uri("/submit-assessment")
            .contentType(MediaType.APPLICATION_JSON)
            .body(report)
            .retrieve()
            .toEntity(String.class);
    }
}
