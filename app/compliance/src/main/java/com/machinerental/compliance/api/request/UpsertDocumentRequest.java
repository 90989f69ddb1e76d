/*
 * どこで: Compliance API リクエスト DTO
 * 何を: 書類の登録/更新 API の入力を定義する
 * なぜ: 受信 JSON を型安全に取り扱うため
 */
package com.machinerental.compliance.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UpsertDocumentRequest(
    @NotNull(message = "machine_id is required") Long machineId,
    @NotBlank(message = "document_type is required") String documentType,
    @NotNull(message = "expiry_date is required") LocalDate expiryDate,
    LocalDate lastRenewedDate,
    String remarks) {}
