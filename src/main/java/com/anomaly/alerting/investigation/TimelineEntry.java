package com.anomaly.alerting.investigation;

import lombok.Value;

import java.time.Instant;

@Value
public class TimelineEntry {
    Instant timestamp;
    String event;
    String details;
}
