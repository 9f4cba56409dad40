package com.anomaly.alerting.api;

import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * REST API request body for resolving an alert. The body itself is optional.
 */
@Data
public class ResolveRequestDto {

    @Size(max = 2000)
    private String notes;
}
