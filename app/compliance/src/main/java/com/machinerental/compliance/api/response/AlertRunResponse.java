/*
 * どこで: Compliance API レスポンス DTO
 * 何を: 期限アラートの手動実行結果 (期限到達分と送信件数)
 * なぜ: 手動トリガーの結果を例外ではなく件数で返すため
 */
package com.machinerental.compliance.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.machinerental.compliance.model.AlertRunSummary;
import com.machinerental.compliance.model.DocumentType;
import com.machinerental.compliance.model.DueNotification;
import java.time.LocalDate;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AlertRunResponse(List<DueItem> notificationsDue, EmailResults emailResults) {

  public AlertRunResponse {
    notificationsDue = notificationsDue == null ? List.of() : List.copyOf(notificationsDue);
  }

  public static AlertRunResponse from(AlertRunSummary summary) {
    return new AlertRunResponse(
        summary.notificationsDue().stream().map(DueItem::from).toList(),
        new EmailResults(summary.sent(), summary.failed(), summary.skipped(), summary.total()));
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record DueItem(
      long documentId,
      String machineNumber,
      String machineName,
      DocumentType documentType,
      LocalDate expiryDate,
      int daysBefore,
      long daysUntilExpiry) {

    static DueItem from(DueNotification notification) {
      return new DueItem(
          notification.documentId(),
          notification.machineNumber(),
          notification.machineName(),
          notification.documentType(),
          notification.expiryDate(),
          notification.daysBefore(),
          notification.daysUntilExpiry());
    }
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record EmailResults(int sent, int failed, int skipped, int total) {}
}
