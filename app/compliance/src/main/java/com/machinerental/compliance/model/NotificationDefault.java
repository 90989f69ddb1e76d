/*
 * どこで: Compliance ドメインモデル
 * 何を: 適用範囲ごとの既定通知日数 (降順の重複なし集合)
 * なぜ: 通知設定のない書類へ一括で閾値を設定するテンプレートとして使うため
 */
package com.machinerental.compliance.model;

import java.time.Instant;
import java.util.List;

public record NotificationDefault(
    NotificationScope scope,
    List<Integer> daysBefore,
    boolean active,
    String createdBy,
    Instant updatedAt) {

  public NotificationDefault {
    daysBefore = daysBefore == null ? List.of() : List.copyOf(daysBefore);
  }
}
