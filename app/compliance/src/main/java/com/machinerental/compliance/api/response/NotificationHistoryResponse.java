package com.machinerental.compliance.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.machinerental.compliance.model.DocumentType;
import com.machinerental.compliance.model.NotificationLogView;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationHistoryResponse(int count, List<Entry> history) {

  public NotificationHistoryResponse {
    history = history == null ? List.of() : List.copyOf(history);
  }

  public static NotificationHistoryResponse from(List<NotificationLogView> logs) {
    final List<Entry> entries = logs.stream().map(Entry::from).toList();
    return new NotificationHistoryResponse(entries.size(), entries);
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Entry(
      long id,
      long documentId,
      String machineNumber,
      String machineName,
      DocumentType documentType,
      int daysBefore,
      LocalDate notificationDate,
      Instant createdAt) {

    static Entry from(NotificationLogView log) {
      return new Entry(
          log.id(),
          log.documentId(),
          log.machineNumber(),
          log.machineName(),
          log.documentType(),
          log.daysBefore(),
          log.notificationDate(),
          log.createdAt());
    }
  }
}
