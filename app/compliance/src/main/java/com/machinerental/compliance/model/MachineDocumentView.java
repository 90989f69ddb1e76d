/*
 * どこで: Compliance ドメインモデル
 * 何を: 書類と機械情報、参照日時点の残日数/状態、有効な通知日数をまとめた読み取りモデル
 * なぜ: 一覧/詳細/手動送信で同じ導出値を使うため
 */
package com.machinerental.compliance.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public record MachineDocumentView(
    long id,
    long machineId,
    String machineNumber,
    String machineName,
    DocumentType documentType,
    LocalDate expiryDate,
    LocalDate lastRenewedDate,
    String remarks,
    Instant createdAt,
    Instant updatedAt,
    long daysUntilExpiry,
    ExpiryStatus status,
    List<Integer> notificationDays) {

  public MachineDocumentView {
    notificationDays = notificationDays == null ? List.of() : List.copyOf(notificationDays);
  }
}
