package com.vitalscan.assessment.batch;

import com.vitalscan.assessment.config.AssessmentProperties;
import com.vitalscan.assessment.domain.AssessmentRunView;
import com.vitalscan.assessment.service.AssessmentRunService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

@Component
public class StartupAssessmentRunner implements ApplicationRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(StartupAssessmentRunner.class);

    private final AssessmentProperties properties;
    private final AssessmentRunService assessmentRunService;

    public StartupAssessmentRunner(AssessmentProperties properties, AssessmentRunService assessmentRunService) {
        this.properties = properties;
        this.assessmentRunService = assessmentRunService;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.isRunOnStartup()) {
            return;
        }
        AssessmentRunView view = assessmentRunService.runAssessment(null);
        LOGGER.info("Startup assessment run {} finished with status {}, submission {}",
            view.runId(), view.status(), view.submission() == null ? "n/a" : view.submission().status());
    }
}
