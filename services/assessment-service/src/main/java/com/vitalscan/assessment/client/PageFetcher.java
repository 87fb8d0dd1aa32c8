package com.vitalscan.assessment.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.vitalscan.assessment.config.AssessmentProperties;
import com.vitalscan.assessment.domain.PatientRecord;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Fetches one page with a bounded number of attempts.
 *
 * <ul>
 *   <li>429: waits {@code rateLimitBaseDelay + rateLimitStepDelay * attemptsSoFar}, then retries</li>
 *   <li>5xx, or a page with no usable records: waits {@code transientDelay}, then retries</li>
 *   <li>anything else: gives up on the page immediately</li>
 * </ul>
 * No wait happens after the last attempt.
 */
@Component
public class PageFetcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(PageFetcher.class);

    private static final int TOO_MANY_REQUESTS = 429;

    private final PatientApiClient patientApiClient;
    private final BackoffSleeper sleeper;
    private final AssessmentProperties properties;

    public PageFetcher(PatientApiClient patientApiClient, BackoffSleeper sleeper, AssessmentProperties properties) {
        this.patientApiClient = patientApiClient;
        this.sleeper = sleeper;
        this.properties = properties;
    }

    public PageFetchResult fetch(int page, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive: " + maxAttempts);
        }

        String lastFailure = "not attempted";
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            LOGGER.info("Fetching page {} (attempt {}/{})", page, attempt + 1, maxAttempts);
            Duration wait;
            try {
                JsonNode body = patientApiClient.fetchPage(page, properties.getPageLimit());
                LOGGER.debug("Raw response for page {}: {}", page, body);

                PageBody pageBody = PageBody.resolve(body);
                List<PatientRecord> records = pageBody.records();
                if (records.isEmpty()) {
                    throw new UnusablePageException("page " + page + " contained no valid patient records ("
                        + pageBody.getClass().getSimpleName() + ")");
                }
                LOGGER.info("Extracted {} patients from page {}", records.size(), page);
                return PageFetchResult.success(page, records, pageBody.hasNext().orElse(null), attempt + 1);
            } catch (RestClientResponseException ex) {
                int status = ex.getStatusCode().value();
                lastFailure = "HTTP " + status;
                if (status == TOO_MANY_REQUESTS) {
                    wait = rateLimitDelay(attempt);
                    LOGGER.warn("Rate limited on page {}, waiting {} ms", page, wait.toMillis());
                } else if (ex.getStatusCode().is5xxServerError()) {
                    wait = transientDelay();
                    LOGGER.warn("Server error {} on page {}, retrying", status, page);
                } else {
                    LOGGER.error("Unexpected HTTP {} on page {}, giving up on this page", status, page);
                    return PageFetchResult.failure(page, attempt + 1, lastFailure);
                }
            } catch (UnusablePageException ex) {
                lastFailure = ex.getMessage();
                wait = transientDelay();
                LOGGER.warn("Unusable response for page {}: {}, retrying", page, ex.getMessage());
            } catch (RestClientException ex) {
                LOGGER.error("Unexpected error on page {}: {}", page, ex.getMessage());
                return PageFetchResult.failure(page, attempt + 1, ex.getMessage());
            }

            if (attempt + 1 < maxAttempts && !pause(wait)) {
                return PageFetchResult.failure(page, attempt + 1, "interrupted while waiting to retry");
            }
        }

        LOGGER.warn("Page {} failed after {} attempts: {}", page, maxAttempts, lastFailure);
        return PageFetchResult.failure(page, maxAttempts, lastFailure);
    }

    Duration rateLimitDelay(int attemptsSoFar) {
        return Duration.ofMillis(properties.getRateLimitBaseDelayMs()
            + properties.getRateLimitStepDelayMs() * attemptsSoFar);
    }

    Duration transientDelay() {
        return Duration.ofMillis(properties.getTransientDelayMs());
    }

    private boolean pause(Duration wait) {
        try {
            sleeper.sleep(wait);
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
