/*
 * どこで: Compliance ドメインモデル
 * 何を: 書類期限アラートのジョブペイロード
 * なぜ: 再送時に書類が更新/削除されていても送信時点の内容で通知できるようにするため
 */
package com.machinerental.compliance.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.LocalDate;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DocumentExpiryPayload(
    long documentId,
    long machineId,
    String machineNumber,
    String machineName,
    DocumentType documentType,
    LocalDate expiryDate,
    long daysUntilExpiry,
    Integer daysBefore) implements EmailJobPayload {

  // 保存済みジョブの読み戻しでも同じ検査を通し、欠損ペイロードを送信前に弾く
  public DocumentExpiryPayload {
    if (documentType == null) {
      throw new IllegalArgumentException("document_type is required");
    }
    if (machineNumber == null || machineNumber.isBlank()) {
      throw new IllegalArgumentException("machine_number is required");
    }
    if (expiryDate == null) {
      throw new IllegalArgumentException("expiry_date is required");
    }
  }

  public static DocumentExpiryPayload from(DueNotification notification) {
    return new DocumentExpiryPayload(
        notification.documentId(),
        notification.machineId(),
        notification.machineNumber(),
        notification.machineName(),
        notification.documentType(),
        notification.expiryDate(),
        notification.daysUntilExpiry(),
        notification.daysBefore());
  }

  public static DocumentExpiryPayload from(MachineDocumentView document) {
    // 手動送信は閾値に依らないため days_before は持たない
    return new DocumentExpiryPayload(
        document.id(),
        document.machineId(),
        document.machineNumber(),
        document.machineName(),
        document.documentType(),
        document.expiryDate(),
        document.daysUntilExpiry(),
        null);
  }

  @Override
  public EmailJobType jobType() {
    return EmailJobType.DOCUMENT_EXPIRY;
  }

  @Override
  public String entityId() {
    return Long.toString(documentId);
  }
}
