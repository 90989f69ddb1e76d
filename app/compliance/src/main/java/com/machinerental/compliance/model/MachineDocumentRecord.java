/*
 * どこで: Compliance ドメインモデル
 * 何を: machine_documents テーブルのスナップショット
 * なぜ: 登録/更新/更新処理で保存値だけを扱うため
 */
package com.machinerental.compliance.model;

import java.time.Instant;
import java.time.LocalDate;

public record MachineDocumentRecord(
    long id,
    long machineId,
    DocumentType documentType,
    LocalDate expiryDate,
    LocalDate lastRenewedDate,
    String remarks,
    Instant createdAt,
    Instant updatedAt) {}
