package com.vitalscan.assessment.domain;

public enum RunStatus {
    RUNNING,
    COMPLETED,
    COMPLETED_WITH_LOSSES,
    FAILED
}
