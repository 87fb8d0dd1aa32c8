package com.vitalscan.assessment.domain;

public record SubmissionOutcome(Status status, Integer httpStatus, String responseBody, String error) {

    public enum Status {
        SUBMITTED,
        FAILED,
        SKIPPED
    }

    public static SubmissionOutcome submitted(int httpStatus, String responseBody) {
        return new SubmissionOutcome(Status.SUBMITTED, httpStatus, responseBody, null);
    }

    public static SubmissionOutcome failed(Integer httpStatus, String error) {
        return new SubmissionOutcome(Status.FAILED, httpStatus, null, error);
    }

    public static SubmissionOutcome skipped() {
        return new SubmissionOutcome(Status.SKIPPED, null, null, null);
    }
}
