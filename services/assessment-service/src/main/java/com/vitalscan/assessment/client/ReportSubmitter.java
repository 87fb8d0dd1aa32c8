package com.vitalscan.assessment.client;

import com.vitalscan.assessment.domain.AssessmentReport;
import com.vitalscan.assessment.domain.SubmissionOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Posts the report once. Failures are logged and returned, never retried.
 */
@Component
public class ReportSubmitter {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReportSubmitter.class);

    private final PatientApiClient patientApiClient;

    public ReportSubmitter(PatientApiClient patientApiClient) {
        this.patientApiClient = patientApiClient;
    }

    public SubmissionOutcome submit(AssessmentReport report) {
        try {
            ResponseEntity<String> response = patientApiClient.submitAssessment(report);
            LOGGER.info("Submission response ({}): {}", response.getStatusCode().value(), response.getBody());
            return SubmissionOutcome.submitted(response.getStatusCode().value(), response.getBody());
        } catch (RestClientResponseException ex) {
            String body = ex.getResponseBodyAsString();
            LOGGER.error("Submission failed with HTTP {}: {}", ex.getStatusCode().value(), body);
            return SubmissionOutcome.failed(ex.getStatusCode().value(), body.isBlank() ? ex.getMessage() : body);
        } catch (RestClientException ex) {
            LOGGER.error("Submission failed: {}", ex.getMessage());
            return SubmissionOutcome.failed(null, ex.getMessage());
        }
    }
}
