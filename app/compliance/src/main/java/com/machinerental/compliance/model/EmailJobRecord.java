/*
 * どこで: Compliance ドメインモデル
 * 何を: email_jobs テーブルのスナップショット
 * なぜ: 配信処理と状態確認 API で共通化するため
 */
package com.machinerental.compliance.model;

import java.time.Instant;

public record EmailJobRecord(
    Long id,
    EmailJobType type,
    String entityId,
    String payloadJson,
    EmailJobStatus status,
    int attempts,
    int maxAttempts,
    String error,
    Instant scheduledFor,
    Instant processedAt,
    String lockedBy,
    Instant lockedAt,
    Instant leaseUntil,
    Instant createdAt,
    Instant updatedAt) {}
