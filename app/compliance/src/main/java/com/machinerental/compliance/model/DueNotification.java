/*
 * どこで: Compliance ドメインモデル
 * 何を: 本日 claim 済みの期限通知 1 件
 * なぜ: 評価結果を配信/キュー投入へ受け渡すため
 */
package com.machinerental.compliance.model;

import java.time.LocalDate;

public record DueNotification(
    long documentId,
    long machineId,
    String machineNumber,
    String machineName,
    DocumentType documentType,
    LocalDate expiryDate,
    int daysBefore,
    long daysUntilExpiry) {}
