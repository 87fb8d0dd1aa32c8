package com.vitalscan.assessment.controller;

public record AssessmentRunRequest(Boolean submit) {
}
