package com.vitalscan.assessment.service;

import com.vitalscan.assessment.client.PageFetchResult;
import com.vitalscan.assessment.client.PageFetcher;
import com.vitalscan.assessment.config.AssessmentProperties;
import com.vitalscan.assessment.domain.CollectionResult;
import com.vitalscan.assessment.domain.DuplicatePolicy;
import com.vitalscan.assessment.domain.PatientRecord;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Walks pages {@code 1..totalPages} one at a time, then gives every page that failed a second
 * chance with the larger recovery budget. Pages that still fail are dropped from the run.
 */
@Service
public class PatientCollector {

    private static final Logger LOGGER = LoggerFactory.getLogger(PatientCollector.class);

    private final PageFetcher pageFetcher;
    private final AssessmentProperties properties;

    public PatientCollector(PageFetcher pageFetcher, AssessmentProperties properties) {
        this.pageFetcher = pageFetcher;
        this.properties = properties;
    }

    public CollectionResult collect() {
        int totalPages = properties.getTotalPages();
        if (totalPages < 1) {
            throw new IllegalArgumentException("totalPages must be positive: " + totalPages);
        }

        Accumulator accumulator = new Accumulator(properties.getDuplicatePolicy());
        Set<Integer> failedPages = new LinkedHashSet<>();

        for (int page = 1; page <= totalPages; page++) {
            PageFetchResult result = pageFetcher.fetch(page, properties.getFirstPassMaxAttempts());
            if (!result.success()) {
                failedPages.add(page);
                continue;
            }
            accumulator.addAll(result.records());
            if (properties.isFollowHasNext() && result.isLastPage()) {
                LOGGER.info("Page {} reports no next page, ending first pass", page);
                break;
            }
        }

        List<Integer> recovered = new ArrayList<>();
        List<Integer> lost = new ArrayList<>();
        if (!failedPages.isEmpty()) {
            LOGGER.warn("Retrying failed pages: {}", failedPages);
            for (int page : failedPages) {
                PageFetchResult result = pageFetcher.fetch(page, properties.getRecoveryMaxAttempts());
                if (result.success()) {
                    accumulator.addAll(result.records());
                    recovered.add(page);
                } else {
                    LOGGER.error("Page {} permanently failed after retries: {}", page, result.failureReason());
                    lost.add(page);
                }
            }
        }

        LOGGER.info("Final patient count: {} ({} duplicates dropped, lost pages {})",
            accumulator.records.size(), accumulator.duplicates, lost);
        return new CollectionResult(accumulator.records, recovered, lost, accumulator.duplicates);
    }

    private static final class Accumulator {
        private final DuplicatePolicy policy;
        private final List<PatientRecord> records = new ArrayList<>();
        private final Set<String> seenIds = new HashSet<>();
        private int duplicates;

        private Accumulator(DuplicatePolicy policy) {
            this.policy = policy == null ? DuplicatePolicy.FIRST_SEEN_WINS : policy;
        }

        private void addAll(List<PatientRecord> incoming) {
            for (PatientRecord record : incoming) {
                if (!seenIds.add(record.patientId()) && policy == DuplicatePolicy.FIRST_SEEN_WINS) {
                    duplicates++;
                    continue;
                }
                records.add(record);
            }
        }
    }
}
