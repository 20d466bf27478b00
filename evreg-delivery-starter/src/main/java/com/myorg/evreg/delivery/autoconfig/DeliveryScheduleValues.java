package com.myorg.evreg.delivery.autoconfig;

import com.myorg.evreg.delivery.DeliveryProperties;
import lombok.RequiredArgsConstructor;

// @Scheduled trong DeliveryScheduledJobs đọc qua SpEL
@RequiredArgsConstructor
public class DeliveryScheduleValues {
    private final DeliveryProperties props;

    public long getReprocessIntervalMs() {
        return props.getReprocessor().getPollInterval().toMillis();
    }

    public long getReprocessInitialDelayMs() {
        return props.getReprocessor().getInitialDelay().toMillis();
    }

    public long getReplayIntervalMs() {
        return props.getFallback().getReplay().getInterval().toMillis();
    }

    public long getReplayInitialDelayMs() {
        return props.getFallback().getReplay().getInitialDelay().toMillis();
    }
}
