package com.vitalscan.assessment.config;

import com.vitalscan.assessment.domain.DuplicatePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "assessment")
public class AssessmentProperties {

    private String baseUrl = "https://assessment.ksensetech.com/api";
    private String apiKey = "";
    private String apiKeyHeader = "x-api-key";
    private int pageLimit = 5;
    private int totalPages = 10;
    private boolean followHasNext = true;
    private int firstPassMaxAttempts = 5;
    private int recoveryMaxAttempts = 8;
    private long rateLimitBaseDelayMs = 4_000;
    private long rateLimitStepDelayMs = 1_000;
    private long transientDelayMs = 2_000;
    private DuplicatePolicy duplicatePolicy = DuplicatePolicy.FIRST_SEEN_WINS;
    private boolean submitEnabled = true;
    private boolean runOnStartup = false;
    private boolean schedulerEnabled = false;
    private long schedulerFixedDelayMs = 3_600_000;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getApiKeyHeader() {
        return apiKeyHeader;
    }

    public void setApiKeyHeader(String apiKeyHeader) {
        this.apiKeyHeader = apiKeyHeader;
    }

    public int getPageLimit() {
        return pageLimit;
    }

    public void setPageLimit(int pageLimit) {
        this.pageLimit = pageLimit;
    }

    public int getTotalPages() {
        return totalPages;
    }

    public void setTotalPages(int totalPages) {
        this.totalPages = totalPages;
    }

    public boolean isFollowHasNext() {
        return followHasNext;
    }

    public void setFollowHasNext(boolean followHasNext) {
        this.followHasNext = followHasNext;
    }

    public int getFirstPassMaxAttempts() {
        return firstPassMaxAttempts;
    }

    public void setFirstPassMaxAttempts(int firstPassMaxAttempts) {
        this.firstPassMaxAttempts = firstPassMaxAttempts;
    }

    public int getRecoveryMaxAttempts() {
        return recoveryMaxAttempts;
    }

    public void setRecoveryMaxAttempts(int recoveryMaxAttempts) {
        this.recoveryMaxAttempts = recoveryMaxAttempts;
    }

    public long getRateLimitBaseDelayMs() {
        return rateLimitBaseDelayMs;
    }

    public void setRateLimitBaseDelayMs(long rateLimitBaseDelayMs) {
        this.rateLimitBaseDelayMs = rateLimitBaseDelayMs;
    }

    public long getRateLimitStepDelayMs() {
        return rateLimitStepDelayMs;
    }

    public void setRateLimitStepDelayMs(long rateLimitStepDelayMs) {
        this.rateLimitStepDelayMs = rateLimitStepDelayMs;
    }

    public long getTransientDelayMs() {
        return transientDelayMs;
    }

    public void setTransientDelayMs(long transientDelayMs) {
        this.transientDelayMs = transientDelayMs;
    }

    public DuplicatePolicy getDuplicatePolicy() {
        return duplicatePolicy;
    }

    public void setDuplicatePolicy(DuplicatePolicy duplicatePolicy) {
        this.duplicatePolicy = duplicatePolicy;
    }

    public boolean isSubmitEnabled() {
        return submitEnabled;
    }

    public void setSubmitEnabled(boolean submitEnabled) {
        this.submitEnabled = submitEnabled;
    }

    public boolean isRunOnStartup() {
        return runOnStartup;
    }

    public void setRunOnStartup(boolean runOnStartup) {
        this.runOnStartup = runOnStartup;
    }

    public boolean isSchedulerEnabled() {
        return schedulerEnabled;
    }

    public void setSchedulerEnabled(boolean schedulerEnabled) {
        this.schedulerEnabled = schedulerEnabled;
    }

    public long getSchedulerFixedDelayMs() {
        return schedulerFixedDelayMs;
    }

    public void setSchedulerFixedDelayMs(long schedulerFixedDelayMs) {
        this.schedulerFixedDelayMs = schedulerFixedDelayMs;
    }
}
