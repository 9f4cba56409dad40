package com.anomaly.alerting.investigation;

import lombok.Value;

import java.time.LocalDate;

@Value
public class HistoricalPoint {
    LocalDate date;
    double value;
}
