package com.vitalscan.assessment.client;

import java.time.Duration;

public interface BackoffSleeper {

    void sleep(Duration delay) throws InterruptedException;
}
