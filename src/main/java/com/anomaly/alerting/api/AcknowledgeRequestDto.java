package com.anomaly.alerting.api;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * REST API request body for acknowledging an alert.
 */
@Data
public class AcknowledgeRequestDto {

    /** Operator taking ownership of the alert. Required. */
    @NotBlank(message = "acknowledgedBy is required")
    private String acknowledgedBy;
}
