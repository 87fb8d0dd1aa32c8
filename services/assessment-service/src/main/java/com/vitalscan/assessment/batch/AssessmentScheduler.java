package com.vitalscan.assessment.batch;

import com.vitalscan.assessment.config.AssessmentProperties;
import com.vitalscan.assessment.service.AssessmentRunService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class AssessmentScheduler {

    private static final Logger LOGGER = LoggerFactory.getLogger(AssessmentScheduler.class);

    private final AssessmentProperties properties;
    private final AssessmentRunService assessmentRunService;

    public AssessmentScheduler(AssessmentProperties properties, AssessmentRunService assessmentRunService) {
        this.properties = properties;
        this.assessmentRunService = assessmentRunService;
    }

    @Scheduled(
        initialDelayString = "${assessment.scheduler-fixed-delay-ms:3600000}",
        fixedDelayString = "${assessment.scheduler-fixed-delay-ms:3600000}"
    )
    public void runScheduledAssessment() {
        if (!properties.isSchedulerEnabled()) {
            return;
        }
        LOGGER.info("Running scheduled assessment");
        assessmentRunService.runAssessment(null);
    }
}
