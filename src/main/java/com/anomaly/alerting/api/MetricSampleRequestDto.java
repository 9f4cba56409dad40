package com.anomaly.alerting.api;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.LocalDate;

/**
 * One daily observation. Recording the same day twice replaces the earlier value.
 */
@Data
public class MetricSampleRequestDto {

    /** ISO date (yyyy-MM-dd), UTC day. */
    @NotNull(message = "date is required")
    private LocalDate date;

    @NotNull(message = "value is required")
    private Double value;
}
