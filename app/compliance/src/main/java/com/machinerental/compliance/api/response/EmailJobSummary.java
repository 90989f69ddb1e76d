/*
 * どこで: Compliance API レスポンス DTO
 * 何を: メール送信ジョブ一覧の要素
 * なぜ: 送信状態と内容を確認できるようにするため
 */
package com.machinerental.compliance.api.response;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.machinerental.compliance.model.EmailJobStatus;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EmailJobSummary(
    long id,
    String type,
    String entityId,
    EmailJobStatus status,
    int attempts,
    int maxAttempts,
    String error,
    Instant scheduledFor,
    Instant processedAt,
    Instant createdAt,
    JsonNode payload) {}
