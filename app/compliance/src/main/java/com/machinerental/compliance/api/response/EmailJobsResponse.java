package com.machinerental.compliance.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EmailJobsResponse(int count, List<EmailJobSummary> jobs) {

  public EmailJobsResponse {
    jobs = jobs == null ? List.of() : List.copyOf(jobs);
  }
}
