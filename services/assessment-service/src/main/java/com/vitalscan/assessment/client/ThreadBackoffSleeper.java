package com.vitalscan.assessment.client;

import java.time.Duration;

public class ThreadBackoffSleeper implements BackoffSleeper {

    @Override
    public void sleep(Duration delay) throws InterruptedException {
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        Thread.sleep(delay.toMillis());
    }
}
