package com.machinerental.compliance.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.machinerental.compliance.model.EmailJobStats;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EmailJobStatsResponse(
    long totalJobs, long completed, long failed, long pending, long last24h) {

  public static EmailJobStatsResponse from(EmailJobStats stats) {
    return new EmailJobStatsResponse(
        stats.totalJobs(), stats.completed(), stats.failed(), stats.pending(), stats.last24h());
  }
}
