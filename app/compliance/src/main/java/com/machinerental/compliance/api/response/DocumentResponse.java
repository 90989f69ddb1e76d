/*
 * どこで: Compliance API レスポンス DTO
 * 何を: 書類 1 件の参照結果 (残日数/状態/通知日数を含む)
 * なぜ: API レスポンスの構造を固定するため
 */
package com.machinerental.compliance.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.machinerental.compliance.model.DocumentType;
import com.machinerental.compliance.model.ExpiryStatus;
import com.machinerental.compliance.model.MachineDocumentView;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DocumentResponse(
    long id,
    long machineId,
    String machineNumber,
    String machineName,
    DocumentType documentType,
    LocalDate expiryDate,
    LocalDate lastRenewedDate,
    String remarks,
    long daysUntilExpiry,
    ExpiryStatus status,
    List<Integer> notificationDays,
    Instant createdAt,
    Instant updatedAt) {

  public DocumentResponse {
    notificationDays = notificationDays == null ? List.of() : List.copyOf(notificationDays);
  }

  public static DocumentResponse from(MachineDocumentView view) {
    return new DocumentResponse(
        view.id(),
        view.machineId(),
        view.machineNumber(),
        view.machineName(),
        view.documentType(),
        view.expiryDate(),
        view.lastRenewedDate(),
        view.remarks(),
        view.daysUntilExpiry(),
        view.status(),
        view.notificationDays(),
        view.createdAt(),
        view.updatedAt());
  }
}
