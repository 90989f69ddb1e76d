package com.machinerental.compliance.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.machinerental.compliance.model.DeliveryOutcome;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DeliveryOutcomeResponse(long jobId, boolean success, String error) {

  public static DeliveryOutcomeResponse from(long jobId, DeliveryOutcome outcome) {
    return new DeliveryOutcomeResponse(jobId, outcome.success(), outcome.error());
  }
}
