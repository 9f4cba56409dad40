package com.anomaly.alerting.domain;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Inclusive instant range.
 */
@Value
public class TimeRange {

    Instant start;
    Instant end;

    public TimeRange(Instant start, Instant end) {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Time range requires both start and end");
        }
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("Time range start " + start + " is after end " + end);
        }
        this.start = start;
        this.end = end;
    }

    /** The range of the given length ending at {@code end}. */
    public static TimeRange ending(Instant end, Duration length) {
        return new TimeRange(end.minus(length), end);
    }

    public boolean contains(Instant instant) {
        return instant != null && !instant.isBefore(start) && !instant.isAfter(end);
    }
}
