/*
 * どこで: Compliance API リクエスト DTO
 * 何を: 複数書類の一括更新手続きの入力を定義する
 * なぜ: 書類 ID と新しい期限日を位置で対応付けて受け取るため
 */
package com.machinerental.compliance.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.validation.constraints.NotEmpty;
import java.time.LocalDate;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "API DTO record はリクエスト受け取り専用であり、防御的コピーを行わないため")
public record BulkRenewRequest(
    @NotEmpty(message = "document_ids must not be empty") List<Long> documentIds,
    @NotEmpty(message = "new_expiry_dates must not be empty") List<LocalDate> newExpiryDates,
    String remarks) {}
