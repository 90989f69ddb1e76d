/*
 * どこで: Compliance ドメインモデル
 * 何を: 期限アラート実行 1 回分の集計
 * なぜ: 手動トリガーへ個別の例外ではなく件数で結果を返すため
 */
package com.machinerental.compliance.model;

import java.util.List;

public record AlertRunSummary(
    List<DueNotification> notificationsDue, int sent, int failed, int skipped, int total) {

  public AlertRunSummary {
    notificationsDue = notificationsDue == null ? List.of() : List.copyOf(notificationsDue);
  }
}
