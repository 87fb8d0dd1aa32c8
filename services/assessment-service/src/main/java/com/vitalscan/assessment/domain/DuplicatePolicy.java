package com.vitalscan.assessment.domain;

public enum DuplicatePolicy {
    FIRST_SEEN_WINS,
    KEEP_ALL
}
