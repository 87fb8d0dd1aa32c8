package com.vitalscan.assessment.client;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

class RecordingSleeper implements BackoffSleeper {

    final List<Duration> delays = new ArrayList<>();

    @Override
    public void sleep(Duration delay) {
        delays.add(delay);
    }
}
