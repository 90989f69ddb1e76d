package com.machinerental.compliance.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.machinerental.compliance.model.DocumentStats;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DocumentStatsResponse(
    long totalDocuments,
    long expiredDocuments,
    long expiringThisWeek,
    long expiringThisMonth,
    long avgDaysUntilExpiry) {

  public static DocumentStatsResponse from(DocumentStats stats) {
    return new DocumentStatsResponse(
        stats.totalDocuments(),
        stats.expiredDocuments(),
        stats.expiringThisWeek(),
        stats.expiringThisMonth(),
        stats.averageDaysUntilExpiry());
  }
}
